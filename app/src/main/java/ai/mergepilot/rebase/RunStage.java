package ai.mergepilot.rebase;

/** States of a rebase run. {@link #label()} is the name that appears in the event log. */
public enum RunStage {
    INITIALIZING("initializing"),
    CONTINUING("continuing"),
    DETECTING_CONFLICTS("detecting_conflicts"),
    RESOLVING_CONFLICTS("resolving_conflicts"),
    VERIFYING_RESOLUTION("verifying_resolution"),
    ROLLING_BACK("rolling_back"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String label;

    RunStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @Override
    public String toString() {
        return label;
    }
}
