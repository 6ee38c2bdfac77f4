package ai.mergepilot.agents;

import java.util.concurrent.CompletableFuture;

/**
 * Produces a resolved version of a conflicted file. On success the resolved content must be on disk at
 * {@link ResolutionRequest#absolutePath()} by the time the future completes.
 */
@FunctionalInterface
public interface ResolutionAgent {
    CompletableFuture<ResolutionOutcome> resolve(ResolutionRequest request);
}
