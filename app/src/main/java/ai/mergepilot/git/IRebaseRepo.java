package ai.mergepilot.git;

import java.nio.file.Path;
import java.util.List;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * The version-control operations a rebase run needs. All calls are synchronous.
 *
 * <p>Queries throw {@link GitAPIException} when the repository cannot be inspected. Commands never throw; failures
 * are reported through {@link GitCommandResult#ok()} with the tool's output attached.
 */
public interface IRebaseRepo {
    /** Root of the working tree; conflict file paths are relative to it. */
    Path workTree();

    boolean isValidRepository();

    boolean branchExists(String name) throws GitAPIException;

    /** True when there are no tracked modifications. Untracked files and empty directories are ignored. */
    boolean isCleanWorkingTree() throws GitAPIException;

    RepoSnapshot currentRevision() throws GitAPIException;

    /**
     * Continue a rebase that is already in progress, or start rebasing {@code source} onto {@code target}. {@code ok}
     * is true only when the replay finished; a replay stopped on conflicts reports false.
     */
    GitCommandResult startOrContinueRebase(String target, String source);

    /** Paths with unmerged index entries, in index order. */
    List<String> listUnmergedFiles() throws GitAPIException;

    boolean isBinary(String path) throws GitAPIException;

    /**
     * Continue the in-progress rebase after conflicts were staged. Reports success when the replay advanced, including
     * when it stopped again on a later commit.
     */
    GitCommandResult continueRebase();

    GitCommandResult stage(String path);

    /** Abort any in-progress rebase and restore branches, HEAD, index and working tree to {@code snapshot}. */
    GitCommandResult hardReset(RepoSnapshot snapshot);
}
