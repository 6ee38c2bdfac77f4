package ai.mergepilot.rebase;

import ai.mergepilot.agents.ResolutionAgent;
import ai.mergepilot.agents.ResolutionOutcome;
import ai.mergepilot.agents.ResolutionRequest;
import ai.mergepilot.agents.VerificationAgent;
import ai.mergepilot.agents.VerificationRequest;
import ai.mergepilot.agents.VerificationVerdict;
import ai.mergepilot.git.IRebaseRepo;
import ai.mergepilot.util.ConflictMarkers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs one resolution round over {@link RunContext#conflictFiles()}: files strictly in order, each resolved, verified
 * and staged before the next is touched. Every step is posted to the run's mailbox, so a retry of the same file is a
 * new {@link FileStep} rather than a nested call.
 */
public class ConflictResolutionEngine {
    private static final Logger logger = LogManager.getLogger(ConflictResolutionEngine.class);

    @FunctionalInterface
    public interface RoundCallback {
        void onRoundComplete(boolean success, @Nullable String error);
    }

    private final IRebaseRepo repo;
    private final ResolutionAgent resolutionAgent;
    private final VerificationAgent verificationAgent;
    private final VerificationGate gate;
    private final Duration agentTimeout;

    public ConflictResolutionEngine(
            IRebaseRepo repo,
            ResolutionAgent resolutionAgent,
            VerificationAgent verificationAgent,
            VerificationGate gate,
            Duration agentTimeout) {
        this.repo = repo;
        this.resolutionAgent = resolutionAgent;
        this.verificationAgent = verificationAgent;
        this.gate = gate;
        this.agentTimeout = agentTimeout;
    }

    /** Starts a round. {@code done} is invoked on the mailbox once every file has been visited. */
    public void runRound(RunContext ctx, RoundCallback done) {
        ctx.clearResolutionErrors();
        ctx.clearConflictedContent();
        post(ctx, FileStep.first(), done);
    }

    private void post(RunContext ctx, FileStep step, RoundCallback done) {
        ctx.mailbox().execute(() -> process(ctx, step, done));
    }

    private void process(RunContext ctx, FileStep step, RoundCallback done) {
        if (ctx.isCancelled()) {
            logger.debug("Run cancelled; abandoning round at file index {}", step.index());
            return;
        }
        var files = ctx.conflictFiles();
        if (step.index() >= files.size()) {
            finishRound(ctx, done);
            return;
        }

        var path = files.get(step.index());
        int attempt = ctx.fileAttempts(path);
        int max = ctx.maxAttemptsGlobal();
        var log = ctx.eventLog();

        if (attempt >= max) {
            ctx.recordError(path, "Failed to resolve after maximum attempts");
            log.append(
                    RunStage.RESOLVING_CONFLICTS,
                    "Maximum resolution attempts (%d) reached for file: %s".formatted(max, path),
                    80,
                    List.of(path),
                    List.of("Failed to resolve after maximum attempts"));
            post(ctx, step.advance(), done);
            return;
        }

        ctx.setStage(RunStage.RESOLVING_CONFLICTS);
        if (step.retry() || attempt > 0) {
            log.append(
                    RunStage.RESOLVING_CONFLICTS,
                    "Retrying conflict resolution for file: %s (attempt %d/%d)".formatted(path, attempt + 1, max),
                    50,
                    List.of(path),
                    List.of());
        } else {
            log.append(RunStage.RESOLVING_CONFLICTS, "Analyzing conflict in file: " + path, 50, List.of(path), List.of());
        }

        var file = repo.workTree().resolve(path);
        var original = step.retry() ? ctx.conflictedContent(path) : null;
        String content;
        if (original != null) {
            // the rejected resolution is still on disk; put the conflict back before asking again
            try {
                Files.writeString(file, original);
            } catch (IOException e) {
                var error = "Failed to restore conflicted content: " + e.getMessage();
                ctx.recordError(path, error);
                log.append(RunStage.RESOLVING_CONFLICTS, "File could not be reset for retry: " + path, 50, List.of(path), List.of(error));
                post(ctx, step.advance(), done);
                return;
            }
            content = original;
        } else {
            content = readIfPossible(file);
        }
        if (content == null) {
            ctx.recordError(path, "File is not readable");
            log.append(RunStage.RESOLVING_CONFLICTS, "File is not readable: " + path, 50, List.of(path), List.of("File is not readable"));
            post(ctx, step.advance(), done);
            return;
        }

        if (!ConflictMarkers.hasConflictMarkers(content)) {
            var staged = repo.stage(path);
            if (staged.ok()) {
                log.append(
                        RunStage.RESOLVING_CONFLICTS,
                        "No conflict markers in %s; staged as-is".formatted(path),
                        50,
                        List.of(path),
                        List.of());
            } else {
                var error = "Failed to stage file without conflict markers: " + staged.output();
                ctx.recordError(path, error);
                log.append(RunStage.RESOLVING_CONFLICTS, "Git add command failed", 50, List.of(path), List.of(error));
            }
            post(ctx, step.advance(), done);
            return;
        }

        ctx.rememberConflictedContent(path, content);
        var request = new ResolutionRequest(path, file, content, attempt, max);
        dispatch(
                ctx,
                "resolve " + path,
                () -> resolutionAgent.resolve(request),
                (outcome, error) -> onResolved(ctx, step, path, file, outcome, error, done));
    }

    private void onResolved(
            RunContext ctx,
            FileStep step,
            String path,
            Path file,
            @Nullable ResolutionOutcome outcome,
            @Nullable Throwable error,
            RoundCallback done) {
        var log = ctx.eventLog();
        String failure = null;
        if (error != null) {
            failure = "Resolution agent failed: " + describe(error);
        } else if (outcome == null) {
            failure = "Resolution agent returned no result";
        } else if (!outcome.ok()) {
            failure = outcome.error() != null ? outcome.error() : "Resolution agent reported failure";
        } else if (!outcome.mutatedContentAvailableOnDisk()) {
            failure = "Resolution agent reported success without writing a resolved file";
        }
        if (failure != null) {
            logger.debug("Resolution of {} failed: {}", path, failure);
            ctx.recordError(path, failure);
            log.append(RunStage.RESOLVING_CONFLICTS, "Failed to resolve conflict in file: " + path, 50, List.of(path), List.of(failure));
            post(ctx, step.advance(), done);
            return;
        }

        var resolved = readIfPossible(file);
        if (resolved == null) {
            var message = "Cannot verify file: %s does not exist or is not readable".formatted(path);
            ctx.recordError(path, message);
            log.append(RunStage.RESOLVING_CONFLICTS, message, 75, List.of(path), List.of(message));
            post(ctx, step.advance(), done);
            return;
        }
        log.append(RunStage.RESOLVING_CONFLICTS, "Resolution completed for file: " + path, 75, List.of(path), List.of());

        int attempt = ctx.fileAttempts(path);
        int max = ctx.maxAttemptsGlobal();
        ctx.setStage(RunStage.VERIFYING_RESOLUTION);
        var details = attempt > 0
                ? "Verifying conflict resolution quality for file: %s (verification attempt %d/%d)".formatted(path, attempt, max)
                : "Verifying conflict resolution quality for file: " + path;
        log.append(RunStage.VERIFYING_RESOLUTION, details, 60, List.of(path), List.of());

        var request = new VerificationRequest(path, resolved, attempt, max);
        dispatch(
                ctx,
                "verify " + path,
                () -> verificationAgent.verify(request),
                (verdict, err) -> onVerified(ctx, step, path, verdict, err, done));
    }

    private void onVerified(
            RunContext ctx,
            FileStep step,
            String path,
            @Nullable VerificationVerdict verdict,
            @Nullable Throwable error,
            RoundCallback done) {
        var log = ctx.eventLog();
        String agentError = null;
        if (error != null) {
            agentError = describe(error);
        } else if (verdict == null) {
            agentError = "no verdict returned";
        } else if (verdict.error() != null) {
            agentError = verdict.error();
        }

        VerificationVerdict effective;
        if (agentError != null) {
            log.append(
                    RunStage.VERIFYING_RESOLUTION,
                    "Verification agent failed for file: " + path,
                    65,
                    List.of(path),
                    List.of(agentError));
            effective = VerificationVerdict.rejected(List.of("Verification agent failed: " + agentError));
        } else {
            effective = verdict;
            if (effective.passed()) {
                log.append(RunStage.VERIFYING_RESOLUTION, "Verification passed for file: " + path, 70, List.of(path), List.of());
            } else {
                var issues = effective.issues().isEmpty() ? List.of("Unknown verification issues") : effective.issues();
                log.append(RunStage.VERIFYING_RESOLUTION, "Verification failed for file: " + path, 70, List.of(path), issues);
            }
        }

        ctx.setStage(RunStage.RESOLVING_CONFLICTS);
        var decision = gate.apply(ctx, path, effective);
        logger.debug("Gate decision for {}: {}", path, decision);
        var next = decision == VerificationGate.Decision.RETRY ? step.retrySame() : step.advance();
        post(ctx, next, done);
    }

    private void finishRound(RunContext ctx, RoundCallback done) {
        var log = ctx.eventLog();
        int total = ctx.conflictFiles().size();
        if (ctx.hasResolutionErrors()) {
            var errors = ctx.resolutionErrors();
            var lines = new ArrayList<String>();
            errors.forEach((file, errs) -> lines.add("File %s: %s".formatted(file, String.join("; ", errs))));
            log.append(
                    RunStage.RESOLVING_CONFLICTS,
                    "Partial resolution failure (%d/%d files)".formatted(errors.size(), total),
                    90,
                    List.copyOf(errors.keySet()),
                    lines);
            var summary = "%d/%d files could not be resolved automatically".formatted(errors.size(), total);
            done.onRoundComplete(false, summary + "\n" + String.join("\n", lines));
            return;
        }

        var continued = repo.continueRebase();
        if (!continued.ok()) {
            var error = "Failed to continue rebase: " + continued.output();
            log.append(RunStage.RESOLVING_CONFLICTS, "Failed to continue rebase", 90, List.of(), List.of(continued.output()));
            done.onRoundComplete(false, error);
            return;
        }
        log.append(
                RunStage.RESOLVING_CONFLICTS,
                "Successfully resolved all conflicts in %d files (Global attempt %d/%d)"
                        .formatted(total, ctx.attemptGlobal(), ctx.maxAttemptsGlobal()),
                100);
        done.onRoundComplete(true, null);
    }

    /**
     * Issues an agent call tracked by the run's operation tracker. The continuation runs on the mailbox, after the
     * operation has been completed, and is skipped once the run is cancelled.
     */
    private <T> void dispatch(
            RunContext ctx, String operation, Supplier<CompletableFuture<T>> call, BiConsumer<T, Throwable> continuation) {
        ctx.tracker().track(operation);
        CompletableFuture<T> future;
        try {
            future = call.get();
            if (future == null) {
                future = CompletableFuture.failedFuture(new IllegalStateException("agent returned no future"));
            }
        } catch (RuntimeException e) {
            logger.warn("Agent call for {} threw", operation, e);
            future = CompletableFuture.failedFuture(e);
        }
        future.orTimeout(agentTimeout.toMillis(), TimeUnit.MILLISECONDS);
        ctx.setInFlight(future);
        if (ctx.isCancelled()) {
            // cancel() ran before the future was published and could not see it
            logger.debug("Run cancelled while dispatching {}; cancelling the agent call", operation);
            future.cancel(true);
        }
        future.whenComplete((value, error) -> ctx.mailbox().execute(() -> {
            ctx.setInFlight(null);
            ctx.tracker().complete(operation, error == null, error == null ? null : describe(error));
            if (ctx.isCancelled() || ctx.stage().isTerminal()) {
                logger.debug("Ignoring result of {} after the run stopped", operation);
                return;
            }
            continuation.accept(value, error);
        }));
    }

    private @Nullable String readIfPossible(Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            return null;
        }
        try {
            return Files.readString(file);
        } catch (IOException e) {
            logger.warn("Unable to read {}: {}", file, e.toString());
            return null;
        }
    }

    private String describe(Throwable error) {
        var cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out after %d seconds".formatted(agentTimeout.toSeconds());
        }
        if (cause instanceof CancellationException) {
            return "cancelled";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
