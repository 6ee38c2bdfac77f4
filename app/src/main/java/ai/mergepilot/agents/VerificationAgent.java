package ai.mergepilot.agents;

import java.util.concurrent.CompletableFuture;

/** Judges whether a resolved file is acceptable. */
@FunctionalInterface
public interface VerificationAgent {
    CompletableFuture<VerificationVerdict> verify(VerificationRequest request);
}
