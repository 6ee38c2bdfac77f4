package ai.mergepilot.rebase;

/** Reasons a run is rejected before anything in the repository is touched. */
public enum ValidationError {
    INVALID_BRANCH_NAME,
    INVALID_MAX_ATTEMPTS,
    NOT_A_REPOSITORY,
    BRANCH_NOT_FOUND,
    DIRTY_WORKING_TREE,
    REPOSITORY_ERROR
}
