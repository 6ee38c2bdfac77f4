package ai.mergepilot.rebase;

import org.jetbrains.annotations.Nullable;

/**
 * Raw caller input for a run. Branch names are validated and sanitised before use.
 *
 * @param maxAttempts null for the default
 */
public record RebaseRequest(String sourceBranch, String targetBranch, @Nullable Integer maxAttempts) {
    public RebaseRequest(String sourceBranch, String targetBranch) {
        this(sourceBranch, targetBranch, null);
    }
}
