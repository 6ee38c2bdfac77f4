package ai.mergepilot.rebase;

import ai.mergepilot.git.IRebaseRepo;
import ai.mergepilot.git.RepoSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * Checks the preconditions of a run and captures the snapshot used for rollback. Nothing in the repository is
 * modified.
 */
public class BranchValidator {
    private static final Logger logger = LogManager.getLogger(BranchValidator.class);

    public static final int MIN_ATTEMPTS = 1;
    public static final int MAX_ATTEMPTS = 10;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /** Validated, sanitised inputs of a run plus the pre-run snapshot. */
    public record ValidatedRun(String sourceRef, String targetRef, int maxAttempts, RepoSnapshot snapshot) {}

    private final IRebaseRepo repo;

    public BranchValidator(IRebaseRepo repo) {
        this.repo = repo;
    }

    public ValidatedRun validate(String sourceBranch, String targetBranch, @Nullable Integer maxAttempts)
            throws ValidationException {
        if (!repo.isValidRepository()) {
            throw new ValidationException(
                    ValidationError.NOT_A_REPOSITORY, "Not a git repository: " + repo.workTree());
        }
        if (sourceBranch.isBlank() || targetBranch.isBlank()) {
            throw new ValidationException(
                    ValidationError.INVALID_BRANCH_NAME, "Source and target branch names must not be empty");
        }
        int attempts = checkMaxAttempts(maxAttempts);

        var source = BranchNames.sanitize(sourceBranch);
        var target = BranchNames.sanitize(targetBranch);
        if (source.isEmpty() || target.isEmpty()) {
            throw new ValidationException(
                    ValidationError.INVALID_BRANCH_NAME,
                    "Branch name contains no valid characters: '%s'".formatted(source.isEmpty() ? sourceBranch : targetBranch));
        }
        if (!source.equals(sourceBranch) || !target.equals(targetBranch)) {
            logger.info("Sanitized branch names: {} -> {}, {} -> {}", sourceBranch, source, targetBranch, target);
        }

        try {
            for (var branch : new String[] {source, target}) {
                if (!repo.branchExists(branch)) {
                    throw new ValidationException(
                            ValidationError.BRANCH_NOT_FOUND, "Branch '%s' does not exist".formatted(branch));
                }
            }
            if (!repo.isCleanWorkingTree()) {
                throw new ValidationException(
                        ValidationError.DIRTY_WORKING_TREE,
                        "Working tree has uncommitted changes; commit or stash them before rebasing");
            }
            var snapshot = repo.currentRevision();
            logger.debug("Validated rebase of {} onto {} at {}", source, target, snapshot.shortId());
            return new ValidatedRun(source, target, attempts, snapshot);
        } catch (GitAPIException e) {
            throw new ValidationException(
                    ValidationError.REPOSITORY_ERROR, "Unable to inspect repository: " + e.getMessage(), e);
        }
    }

    static int checkMaxAttempts(@Nullable Integer maxAttempts) throws ValidationException {
        if (maxAttempts == null) {
            return DEFAULT_MAX_ATTEMPTS;
        }
        if (maxAttempts < MIN_ATTEMPTS || maxAttempts > MAX_ATTEMPTS) {
            throw new ValidationException(
                    ValidationError.INVALID_MAX_ATTEMPTS,
                    "maxAttempts must be between %d and %d, got %d".formatted(MIN_ATTEMPTS, MAX_ATTEMPTS, maxAttempts));
        }
        return maxAttempts;
    }
}
