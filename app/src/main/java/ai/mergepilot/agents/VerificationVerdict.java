package ai.mergepilot.agents;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Result of a verification. {@code error} is set when the agent could not produce a verdict at all; {@code passed}
 * is then false and {@code issues} empty.
 */
public record VerificationVerdict(boolean passed, List<String> issues, @Nullable String error) {
    public VerificationVerdict {
        issues = List.copyOf(issues);
    }

    public static VerificationVerdict accepted() {
        return new VerificationVerdict(true, List.of(), null);
    }

    public static VerificationVerdict rejected(List<String> issues) {
        return new VerificationVerdict(false, issues, null);
    }

    public static VerificationVerdict failed(String error) {
        return new VerificationVerdict(false, List.of(), error);
    }

    public boolean isError() {
        return error != null;
    }
}
