package ai.mergepilot.agents;

import org.jetbrains.annotations.Nullable;

public record ResolutionOutcome(boolean ok, boolean mutatedContentAvailableOnDisk, @Nullable String error) {
    public static ResolutionOutcome resolved() {
        return new ResolutionOutcome(true, true, null);
    }

    public static ResolutionOutcome failed(String error) {
        return new ResolutionOutcome(false, false, error);
    }
}
