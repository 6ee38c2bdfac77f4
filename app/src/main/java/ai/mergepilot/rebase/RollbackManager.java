package ai.mergepilot.rebase;

import ai.mergepilot.git.GitCommandResult;
import ai.mergepilot.git.IRebaseRepo;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Restores the repository to the run's initial snapshot. One instance per run; only the first call does anything. */
public class RollbackManager {
    private static final Logger logger = LogManager.getLogger(RollbackManager.class);

    private final IRebaseRepo repo;
    private final AtomicBoolean invoked = new AtomicBoolean();

    public RollbackManager(IRebaseRepo repo) {
        this.repo = repo;
    }

    /**
     * Hard-resets to the initial snapshot and logs the outcome of the reset. Returns whether the reset succeeded; a
     * failed reset is reported only through the log.
     */
    public boolean rollback(RunContext ctx) {
        if (!invoked.compareAndSet(false, true)) {
            logger.warn("Rollback already performed for this run; ignoring repeated request");
            return false;
        }
        var snapshot = ctx.initialSnapshot();
        ctx.setStage(RunStage.ROLLING_BACK);
        ctx.eventLog().append(RunStage.ROLLING_BACK, "Rolling back repository to " + snapshot.shortId(), 95);

        GitCommandResult result;
        try {
            result = repo.hardReset(snapshot);
        } catch (RuntimeException e) {
            logger.error("Hard reset threw", e);
            result = GitCommandResult.failure(String.valueOf(e.getMessage()));
        }

        if (result.ok()) {
            logger.info("Repository restored to {}", snapshot.shortId());
            ctx.eventLog().append(RunStage.ROLLING_BACK, "Repository restored to " + snapshot.shortId(), 100);
        } else {
            logger.error("Rollback to {} failed: {}", snapshot.shortId(), result.output());
            ctx.eventLog()
                    .append(
                            RunStage.ROLLING_BACK,
                            "Rollback failed; repository may need manual cleanup",
                            100,
                            List.of(),
                            List.of(result.output()));
        }
        return result.ok();
    }

    public boolean hasRun() {
        return invoked.get();
    }
}
