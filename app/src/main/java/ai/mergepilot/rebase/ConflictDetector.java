package ai.mergepilot.rebase;

import ai.mergepilot.git.GitCommandResult;
import ai.mergepilot.git.IRebaseRepo;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * Starts or continues the rebase and lists the conflicted files the engine is allowed to touch. Binary files, lock
 * files and paths outside a conservative character set are left for the user.
 */
public class ConflictDetector {
    private static final Logger logger = LogManager.getLogger(ConflictDetector.class);

    private static final Pattern SAFE_PATH = Pattern.compile("^[A-Za-z0-9_./-]+$");

    /**
     * @param rebase result of the start/continue operation
     * @param files conflicted files to resolve, in detection order
     * @param skipped unmerged files excluded by the filters
     */
    public record Detection(GitCommandResult rebase, List<String> files, List<String> skipped) {
        public Detection {
            files = List.copyOf(files);
            skipped = List.copyOf(skipped);
        }
    }

    private final IRebaseRepo repo;

    public ConflictDetector(IRebaseRepo repo) {
        this.repo = repo;
    }

    public Detection detect(String targetRef, String sourceRef) throws GitAPIException {
        var rebase = repo.startOrContinueRebase(targetRef, sourceRef);
        logger.debug("Rebase step ok={}: {}", rebase.ok(), rebase.output());

        var files = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        for (var path : repo.listUnmergedFiles()) {
            if (isEligible(path)) {
                files.add(path);
            } else {
                skipped.add(path);
            }
        }
        if (!skipped.isEmpty()) {
            logger.info("Skipping {} conflicted file(s) that cannot be resolved automatically: {}", skipped.size(), skipped);
        }
        return new Detection(rebase, files, skipped);
    }

    boolean isEligible(String path) throws GitAPIException {
        if (!isSafePath(path)) {
            logger.debug("Unsafe path {}", path);
            return false;
        }
        if (path.endsWith(".lock")) {
            logger.debug("Lock file {}", path);
            return false;
        }
        if (repo.isBinary(path)) {
            logger.debug("Binary file {}", path);
            return false;
        }
        return true;
    }

    static boolean isSafePath(String path) {
        if (!SAFE_PATH.matcher(path).matches() || path.startsWith("/")) {
            return false;
        }
        for (var segment : path.split("/")) {
            if (segment.equals("..")) {
                return false;
            }
        }
        return true;
    }
}
