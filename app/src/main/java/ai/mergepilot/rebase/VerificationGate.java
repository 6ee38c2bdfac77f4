package ai.mergepilot.rebase;

import ai.mergepilot.agents.VerificationVerdict;
import ai.mergepilot.git.IRebaseRepo;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * Turns a verification verdict into the engine's next move. Accepted files are staged; rejected files are counted
 * against the per-file ceiling and either retried or given up on.
 */
public class VerificationGate {
    private static final Logger logger = LogManager.getLogger(VerificationGate.class);

    public enum Decision {
        /** Verified and staged; advance. */
        ACCEPTED,
        /** Rejected with attempts left; resolve the same file again. */
        RETRY,
        /** Rejected and out of attempts; error recorded, advance. */
        EXHAUSTED,
        /** Verified but could not be staged; error recorded, advance. */
        STAGING_FAILED
    }

    private final IRebaseRepo repo;

    public VerificationGate(IRebaseRepo repo) {
        this.repo = repo;
    }

    public Decision apply(RunContext ctx, String path, VerificationVerdict verdict) {
        return verdict.passed() ? accept(ctx, path) : reject(ctx, path, verdict.issues());
    }

    private Decision accept(RunContext ctx, String path) {
        var log = ctx.eventLog();
        log.append(RunStage.RESOLVING_CONFLICTS, "Verification passed, staging file: " + path, 80, List.of(path), List.of());

        var staged = repo.stage(path);
        if (!staged.ok()) {
            var error = "Failed to stage resolved file: " + staged.output();
            ctx.recordError(path, error);
            log.append(RunStage.RESOLVING_CONFLICTS, "Git add command failed", 85, List.of(path), List.of(error));
            return Decision.STAGING_FAILED;
        }

        String confirmError = null;
        try {
            if (repo.listUnmergedFiles().contains(path)) {
                confirmError = "File was not properly staged despite successful git add";
            }
        } catch (GitAPIException e) {
            logger.warn("Could not confirm staging of {}", path, e);
            confirmError = "Could not confirm staging: " + e.getMessage();
        }
        if (confirmError != null) {
            ctx.recordError(path, confirmError);
            log.append(RunStage.RESOLVING_CONFLICTS, "Staging verification failed", 85, List.of(path), List.of(confirmError));
            return Decision.STAGING_FAILED;
        }

        log.append(
                RunStage.RESOLVING_CONFLICTS,
                "Successfully verified and staged resolved file: " + path,
                85,
                List.of(path),
                List.of());
        return Decision.ACCEPTED;
    }

    private Decision reject(RunContext ctx, String path, List<String> reported) {
        var log = ctx.eventLog();
        var issues = reported.isEmpty() ? List.of("Unknown verification issues") : reported;
        var message = IssueCategory.describe(issues);
        int attempt = ctx.recordFileAttempt(path);
        int max = ctx.maxAttemptsGlobal();

        log.append(
                RunStage.RESOLVING_CONFLICTS,
                "Resolution verification failed (attempt %d/%d) - %s"
                        .formatted(attempt, max, IssueCategory.primary(issues).shortLabel()),
                80,
                List.of(path),
                issues);

        if (attempt < max) {
            logger.debug("Retrying {} after rejection {}/{}", path, attempt, max);
            log.append(
                    RunStage.RESOLVING_CONFLICTS,
                    "Retrying resolution for file: %s (attempt %d/%d)".formatted(path, attempt + 1, max),
                    80,
                    List.of(path),
                    issues);
            return Decision.RETRY;
        }

        ctx.recordError(path, message);
        log.append(
                RunStage.RESOLVING_CONFLICTS,
                "Maximum resolution attempts (%d) reached for file: %s".formatted(max, path),
                80,
                List.of(path),
                List.of("Failed to resolve after maximum attempts"));
        return Decision.EXHAUSTED;
    }
}
