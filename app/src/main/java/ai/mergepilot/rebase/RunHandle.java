package ai.mergepilot.rebase;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/** Caller-side view of a run: cancellation, the eventual result and read-only progress. */
public final class RunHandle {
    private final @Nullable RunContext ctx;
    private final ProgressLog eventLog;
    private final CompletableFuture<RunResult> result;
    private final Runnable canceller;
    private final @Nullable ValidationError validationError;

    RunHandle(RunContext ctx, CompletableFuture<RunResult> result, Runnable canceller) {
        this.ctx = ctx;
        this.eventLog = ctx.eventLog();
        this.result = result;
        this.canceller = canceller;
        this.validationError = null;
    }

    /** Handle for a run rejected during validation; it is already done. */
    RunHandle(ProgressLog eventLog, RunResult rejected, ValidationError validationError) {
        this.ctx = null;
        this.eventLog = eventLog;
        this.result = CompletableFuture.completedFuture(rejected);
        this.canceller = () -> {};
        this.validationError = validationError;
    }

    /** Stops the run: the in-flight agent call is cancelled and the run fails with "Rebase cancelled" and rolls back. */
    public void cancel() {
        canceller.run();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<RunResult> result() {
        return result;
    }

    /** Set when the run never started because its inputs or the repository failed validation. */
    public @Nullable ValidationError validationError() {
        return validationError;
    }

    public RunStage stage() {
        return ctx == null ? RunStage.FAILED : ctx.stage();
    }

    public int attemptGlobal() {
        return ctx == null ? 0 : ctx.attemptGlobal();
    }

    public int fileAttempts(String path) {
        return ctx == null ? 0 : ctx.fileAttempts(path);
    }

    public Map<String, Integer> fileAttempts() {
        return ctx == null ? Map.of() : ctx.fileAttempts();
    }

    public List<String> conflictFiles() {
        return ctx == null ? List.of() : ctx.conflictFiles();
    }

    public List<LogEntry> eventLog() {
        return eventLog.entries();
    }

    @Nullable
    RunContext context() {
        return ctx;
    }
}
