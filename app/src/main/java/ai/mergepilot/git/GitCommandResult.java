package ai.mergepilot.git;

/** Outcome of a repository-mutating command: whether it succeeded and the human-readable output it produced. */
public record GitCommandResult(boolean ok, String output) {
    public static GitCommandResult success(String output) {
        return new GitCommandResult(true, output);
    }

    public static GitCommandResult failure(String output) {
        return new GitCommandResult(false, output);
    }
}
