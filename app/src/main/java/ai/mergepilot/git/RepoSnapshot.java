package ai.mergepilot.git;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable reference to the repository state captured before a run mutates anything.
 *
 * @param commitId the commit HEAD pointed at
 * @param branch the branch HEAD was attached to, or null for a detached HEAD
 * @param branchTips the tip commit of every local branch, keyed by short branch name
 */
public record RepoSnapshot(String commitId, @Nullable String branch, Map<String, String> branchTips) {
    public RepoSnapshot {
        branchTips = Map.copyOf(branchTips);
    }

    public String shortId() {
        return commitId.length() > 7 ? commitId.substring(0, 7) : commitId;
    }
}
