package ai.mergepilot.git;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.RebaseCommand;
import org.eclipse.jgit.api.RebaseResult;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.RepositoryState;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

/**
 * {@link IRebaseRepo} backed by JGit.
 *
 * <p>The repository is located the same way {@code git} does it: the given directory or one of its parents must
 * contain the git dir. When none is found the instance is still created so that {@link #isValidRepository()} can
 * report the problem instead of the constructor.
 */
public class GitRebaseRepo implements IRebaseRepo, Closeable {
    private static final Logger logger = LogManager.getLogger(GitRebaseRepo.class);

    private static final Set<RepositoryState> REBASE_STATES = EnumSet.of(
            RepositoryState.REBASING,
            RepositoryState.REBASING_REBASING,
            RepositoryState.REBASING_MERGE,
            RepositoryState.REBASING_INTERACTIVE);

    private static final Set<RefUpdate.Result> REF_UPDATE_OK = EnumSet.of(
            RefUpdate.Result.NEW,
            RefUpdate.Result.FORCED,
            RefUpdate.Result.FAST_FORWARD,
            RefUpdate.Result.NO_CHANGE);

    private final Path workTree;
    private final Repository repository;
    private final Git git;

    public GitRebaseRepo(Path root) {
        this.workTree = root.toAbsolutePath().normalize();
        try {
            var builder = new FileRepositoryBuilder().setWorkTree(workTree.toFile()).findGitDir(workTree.toFile());
            if (builder.getGitDir() == null) {
                logger.debug("No git dir found at or above {}", workTree);
                builder.setGitDir(workTree.resolve(Constants.DOT_GIT).toFile());
            }
            repository = builder.build();
            git = new Git(repository);
            logger.trace("Git dir for {} is {}", workTree, repository.getDirectory());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open repository at " + root, e);
        }
    }

    @Override
    public Path workTree() {
        return workTree;
    }

    @Override
    public boolean isValidRepository() {
        try {
            return repository.getObjectDatabase().exists()
                    && !repository.isBare()
                    && repository.resolve(Constants.HEAD) != null;
        } catch (IOException | RevisionSyntaxException e) {
            logger.debug("Repository at {} is not usable: {}", workTree, e.toString());
            return false;
        }
    }

    @Override
    public boolean branchExists(String name) throws GitAPIException {
        if (name.isBlank()) {
            return false;
        }
        try {
            return repository.resolve(name + "^{commit}") != null;
        } catch (RevisionSyntaxException e) {
            logger.debug("Invalid revision syntax for {}: {}", name, e.getMessage());
            return false;
        } catch (IOException e) {
            throw new GitOperationException("Unable to resolve " + name, e);
        }
    }

    @Override
    public boolean isCleanWorkingTree() throws GitAPIException {
        return !git.status().call().hasUncommittedChanges();
    }

    @Override
    public RepoSnapshot currentRevision() throws GitAPIException {
        try {
            var head = repository.resolve(Constants.HEAD);
            if (head == null) {
                throw new GitOperationException("Repository has no HEAD");
            }
            var fullBranch = repository.getFullBranch();
            String branch = fullBranch != null && fullBranch.startsWith(Constants.R_HEADS)
                    ? Repository.shortenRefName(fullBranch)
                    : null;

            var tips = new LinkedHashMap<String, String>();
            for (var ref : repository.getRefDatabase().getRefsByPrefix(Constants.R_HEADS)) {
                var id = ref.getObjectId();
                if (id != null) {
                    tips.put(Repository.shortenRefName(ref.getName()), id.getName());
                }
            }
            return new RepoSnapshot(head.getName(), branch, tips);
        } catch (IOException e) {
            throw new GitOperationException("Unable to read current revision", e);
        }
    }

    @Override
    public GitCommandResult startOrContinueRebase(String target, String source) {
        try {
            if (isRebasing()) {
                var unmerged = listUnmergedFiles();
                if (!unmerged.isEmpty()) {
                    return GitCommandResult.failure(
                            "Rebase stopped with unresolved conflicts in: " + String.join(", ", unmerged));
                }
                logger.debug("Rebase already in progress with no unmerged paths; continuing");
                return describe(continueOrSkip());
            }

            if (!source.equals(repository.getBranch())) {
                logger.debug("Checking out {} before rebasing onto {}", source, target);
                git.checkout().setName(source).call();
            }
            var result = git.rebase().setUpstream(target).call();
            return describe(result);
        } catch (GitAPIException | IOException e) {
            logger.warn("Rebase of {} onto {} failed: {}", source, target, e.getMessage());
            return GitCommandResult.failure("Rebase of '%s' onto '%s' failed: %s".formatted(source, target, e.getMessage()));
        }
    }

    @Override
    public List<String> listUnmergedFiles() throws GitAPIException {
        try {
            var dirCache = repository.readDirCache();
            var paths = new LinkedHashSet<String>();
            for (int i = 0; i < dirCache.getEntryCount(); i++) {
                var entry = dirCache.getEntry(i);
                if (entry.getStage() != 0) {
                    paths.add(entry.getPathString());
                }
            }
            return new ArrayList<>(paths);
        } catch (IOException e) {
            throw new GitOperationException("Unable to read index", e);
        }
    }

    @Override
    public boolean isBinary(String path) throws GitAPIException {
        var file = workTree.resolve(path);
        if (!Files.isRegularFile(file)) {
            return false;
        }
        try {
            return RawText.isBinary(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new GitOperationException("Unable to read " + path, e);
        }
    }

    @Override
    public GitCommandResult continueRebase() {
        if (!isRebasing()) {
            return GitCommandResult.failure("No rebase in progress");
        }
        try {
            var result = continueOrSkip();
            if (!result.getStatus().isSuccessful() && result.getStatus() == RebaseResult.Status.STOPPED && isRebasing()) {
                // the replay moved on and stopped at a later commit; the next detection picks those conflicts up
                return GitCommandResult.success("Rebase advanced and stopped at a later commit: " + summarize(result));
            }
            return describe(result);
        } catch (GitAPIException e) {
            logger.warn("Continuing rebase failed: {}", e.getMessage());
            return GitCommandResult.failure(e.getMessage());
        }
    }

    @Override
    public GitCommandResult stage(String path) {
        try {
            git.add().addFilepattern(path).call();
            return GitCommandResult.success("Staged " + path);
        } catch (GitAPIException e) {
            logger.warn("Failed to stage {}: {}", path, e.getMessage());
            return GitCommandResult.failure(e.getMessage());
        }
    }

    @Override
    public GitCommandResult hardReset(RepoSnapshot snapshot) {
        var output = new ArrayList<String>();
        try {
            if (isRebasing()) {
                git.rebase().setOperation(RebaseCommand.Operation.ABORT).call();
                output.add("Aborted in-progress rebase");
            }

            for (var tip : snapshot.branchTips().entrySet()) {
                var refName = Constants.R_HEADS + tip.getKey();
                var current = repository.exactRef(refName);
                if (current != null
                        && current.getObjectId() != null
                        && current.getObjectId().getName().equals(tip.getValue())) {
                    continue;
                }
                var update = repository.updateRef(refName);
                update.setNewObjectId(ObjectId.fromString(tip.getValue()));
                update.setRefLogMessage("mergepilot: rollback", false);
                var res = update.forceUpdate();
                if (!REF_UPDATE_OK.contains(res)) {
                    return GitCommandResult.failure("Could not restore branch %s: %s".formatted(tip.getKey(), res));
                }
                output.add("Restored %s to %s".formatted(tip.getKey(), tip.getValue()));
            }

            var branch = snapshot.branch();
            RefUpdate.Result headResult;
            if (branch != null) {
                headResult = repository.updateRef(Constants.HEAD).link(Constants.R_HEADS + branch);
            } else {
                var headUpdate = repository.updateRef(Constants.HEAD, true);
                headUpdate.setNewObjectId(ObjectId.fromString(snapshot.commitId()));
                headResult = headUpdate.forceUpdate();
            }
            if (!REF_UPDATE_OK.contains(headResult)) {
                return GitCommandResult.failure("Could not restore HEAD: " + headResult);
            }

            git.reset()
                    .setMode(ResetCommand.ResetType.HARD)
                    .setRef(snapshot.commitId())
                    .call();
            output.add("HEAD is now at " + snapshot.shortId());
            return GitCommandResult.success(String.join("\n", output));
        } catch (GitAPIException | IOException e) {
            logger.error("Hard reset to {} failed", snapshot.commitId(), e);
            output.add("Reset failed: " + e.getMessage());
            return GitCommandResult.failure(String.join("\n", output));
        }
    }

    boolean isRebasing() {
        return REBASE_STATES.contains(repository.getRepositoryState());
    }

    private RebaseResult continueOrSkip() throws GitAPIException {
        var result = git.rebase().setOperation(RebaseCommand.Operation.CONTINUE).call();
        if (result.getStatus() == RebaseResult.Status.NOTHING_TO_COMMIT) {
            logger.debug("Resolved commit is empty; skipping it");
            result = git.rebase().setOperation(RebaseCommand.Operation.SKIP).call();
        }
        return result;
    }

    private static GitCommandResult describe(RebaseResult result) {
        var text = summarize(result);
        return result.getStatus().isSuccessful() ? GitCommandResult.success(text) : GitCommandResult.failure(text);
    }

    private static String summarize(RebaseResult result) {
        var sb = new StringBuilder("Rebase status: ").append(result.getStatus());
        var commit = result.getCurrentCommit();
        if (commit != null) {
            sb.append(" at ").append(commit.abbreviate(7).name()).append(' ').append(commit.getShortMessage());
        }
        var conflicts = result.getConflicts();
        if (conflicts != null && !conflicts.isEmpty()) {
            sb.append("\nConflicts: ").append(String.join(", ", conflicts));
        }
        var failing = result.getFailingPaths();
        if (failing != null && !failing.isEmpty()) {
            sb.append("\nFailing paths: ").append(failing);
        }
        var uncommitted = result.getUncommittedChanges();
        if (uncommitted != null && !uncommitted.isEmpty()) {
            sb.append("\nUncommitted changes: ").append(String.join(", ", uncommitted));
        }
        return sb.toString();
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }
}
