package ai.mergepilot.git;

import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * Thrown when a repository query cannot be answered (unreadable object database, unresolvable revision, I/O failure
 * while inspecting the index). Concrete subclass of GitAPIException so callers can keep a single catch clause for
 * every JGit failure.
 */
public class GitOperationException extends GitAPIException {
    public GitOperationException(String message) {
        super(message);
    }

    public GitOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
