package ai.mergepilot.rebase;

import ai.mergepilot.agents.ResolutionAgent;
import ai.mergepilot.agents.VerificationAgent;
import ai.mergepilot.git.IRebaseRepo;
import ai.mergepilot.git.RepoSnapshot;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * Drives rebase runs: validate, then alternate conflict detection and resolution rounds until the rebase finishes or
 * the attempt ceiling is hit, rolling back on failure.
 *
 * <p>Nothing here blocks on the agents. Each run owns a {@link RunMailbox}; agent callbacks post their continuations
 * to it and the run advances on whichever thread drains it. {@link RunListener#onComplete} is called exactly once per
 * run.
 */
public class RebaseWorkflow {
    private static final Logger logger = LogManager.getLogger(RebaseWorkflow.class);

    public static final Duration DEFAULT_AGENT_TIMEOUT = Duration.ofSeconds(600);

    private final IRebaseRepo repo;
    private final ResolutionAgent resolutionAgent;
    private final VerificationAgent verificationAgent;
    private final Duration agentTimeout;

    public RebaseWorkflow(IRebaseRepo repo, ResolutionAgent resolutionAgent, VerificationAgent verificationAgent) {
        this(repo, resolutionAgent, verificationAgent, DEFAULT_AGENT_TIMEOUT);
    }

    public RebaseWorkflow(
            IRebaseRepo repo,
            ResolutionAgent resolutionAgent,
            VerificationAgent verificationAgent,
            Duration agentTimeout) {
        this.repo = repo;
        this.resolutionAgent = resolutionAgent;
        this.verificationAgent = verificationAgent;
        this.agentTimeout = agentTimeout;
    }

    /**
     * Validates the request and starts the run. A request that fails validation completes the listener with failure
     * before this method returns and nothing in the repository is touched.
     */
    public RunHandle start(RebaseRequest request, RunListener listener) {
        var eventLog = new ProgressLog(listener::onLog);
        eventLog.append(
                RunStage.INITIALIZING,
                "Validating rebase of %s onto %s".formatted(request.sourceBranch(), request.targetBranch()),
                10);

        BranchValidator.ValidatedRun validated;
        try {
            validated = new BranchValidator(repo)
                    .validate(request.sourceBranch(), request.targetBranch(), request.maxAttempts());
        } catch (ValidationException e) {
            logger.info("Rebase request rejected ({}): {}", e.error(), e.getMessage());
            eventLog.append(RunStage.FAILED, "Validation failed: " + e.getMessage(), 100, List.of(), List.of(e.getMessage()));
            var result = new RunResult(false, e.getMessage(), eventLog.entries());
            notifyComplete(listener, false, e.getMessage());
            return new RunHandle(eventLog, result, e.error());
        }

        var run = new Run(validated.sourceRef(), validated.targetRef(), validated.maxAttempts(), validated.snapshot(), eventLog, listener);
        run.begin(false);
        return run.handle;
    }

    /**
     * Starts a new run that continues the rebase left behind by {@code previous}, reusing its branches, ceiling and
     * rollback snapshot. Validation is skipped.
     */
    public RunHandle resume(RunHandle previous, RunListener listener) {
        var ctx = previous.context();
        if (ctx == null) {
            throw new IllegalArgumentException("Cannot resume a run that failed validation");
        }
        if (!previous.isDone()) {
            throw new IllegalStateException("Previous run is still in progress");
        }
        var run = new Run(
                ctx.sourceRef(),
                ctx.targetRef(),
                ctx.maxAttemptsGlobal(),
                ctx.initialSnapshot(),
                new ProgressLog(listener::onLog),
                listener);
        run.begin(true);
        return run.handle;
    }

    /**
     * Continues a rebase that was started outside this workflow. Only the request itself is checked; the repository
     * is expected to be mid-rebase. {@code snapshot} is where a failure rolls back to.
     */
    public RunHandle continueInProgress(RebaseRequest request, RepoSnapshot snapshot, RunListener listener)
            throws ValidationException {
        var source = BranchNames.sanitize(request.sourceBranch());
        var target = BranchNames.sanitize(request.targetBranch());
        if (source.isEmpty() || target.isEmpty()) {
            throw new ValidationException(
                    ValidationError.INVALID_BRANCH_NAME, "Source and target branch names must not be empty");
        }
        int maxAttempts = BranchValidator.checkMaxAttempts(request.maxAttempts());
        var run = new Run(source, target, maxAttempts, snapshot, new ProgressLog(listener::onLog), listener);
        run.begin(true);
        return run.handle;
    }

    private static void notifyComplete(RunListener listener, boolean success, @Nullable String error) {
        try {
            listener.onComplete(success, error);
        } catch (RuntimeException e) {
            logger.warn("Run listener threw from onComplete", e);
        }
    }

    /** One run of the state machine. */
    private final class Run {
        private static final String RUN_OPERATION = "run";

        private final RunContext ctx;
        private final RunListener listener;
        private final ConflictDetector detector;
        private final ConflictResolutionEngine engine;
        private final RollbackManager rollback;
        private final CompletableFuture<RunResult> result = new CompletableFuture<>();
        private final AtomicBoolean terminating = new AtomicBoolean();
        private final RunHandle handle;

        Run(String source, String target, int maxAttempts, RepoSnapshot snapshot, ProgressLog eventLog, RunListener listener) {
            this.listener = listener;
            var mailbox = new RunMailbox(e -> fail("Unexpected error: " + e));
            var tracker = new AsyncOperationTracker(this::finish);
            this.ctx = new RunContext(source, target, maxAttempts, snapshot, eventLog, tracker, mailbox);
            this.detector = new ConflictDetector(repo);
            this.engine = new ConflictResolutionEngine(
                    repo, resolutionAgent, verificationAgent, new VerificationGate(repo), agentTimeout);
            this.rollback = new RollbackManager(repo);
            this.handle = new RunHandle(ctx, result, this::cancel);
        }

        void begin(boolean continuing) {
            ctx.tracker().track(RUN_OPERATION);
            ctx.mailbox().execute(() -> {
                if (continuing) {
                    ctx.setStage(RunStage.CONTINUING);
                    log(RunStage.CONTINUING,
                        "Continuing in-progress rebase of %s onto %s".formatted(ctx.sourceRef(), ctx.targetRef()),
                        10);
                } else {
                    log(RunStage.INITIALIZING,
                        "Starting rebase of %s onto %s (max attempts %d, snapshot %s)"
                                .formatted(ctx.sourceRef(), ctx.targetRef(), ctx.maxAttemptsGlobal(), ctx.initialSnapshot().shortId()),
                        10);
                }
                detect();
            });
        }

        private void detect() {
            if (ctx.isCancelled()) {
                return;
            }
            ctx.setStage(RunStage.DETECTING_CONFLICTS);
            log(RunStage.DETECTING_CONFLICTS, "Checking for conflicts", 20);

            ConflictDetector.Detection detection;
            try {
                detection = detector.detect(ctx.targetRef(), ctx.sourceRef());
            } catch (GitAPIException e) {
                logger.warn("Conflict detection failed", e);
                fail("Failed to detect conflicts: " + e.getMessage());
                return;
            }
            ctx.replaceConflictFiles(detection.files());

            if (detection.files().isEmpty()) {
                if (!detection.rebase().ok()) {
                    var reason = detection.skipped().isEmpty()
                            ? "Rebase failed and no conflicted files could be identified: " + detection.rebase().output()
                            : "Rebase stopped on conflicts that cannot be resolved automatically: "
                                    + String.join(", ", detection.skipped());
                    fail(reason);
                    return;
                }
                succeed();
                return;
            }

            ctx.eventLog()
                    .append(
                            RunStage.DETECTING_CONFLICTS,
                            "Found %d conflicted file(s)".formatted(detection.files().size()),
                            20,
                            detection.files(),
                            List.of());
            ctx.mailbox().execute(this::resolve);
        }

        private void resolve() {
            if (ctx.isCancelled()) {
                return;
            }
            ctx.setStage(RunStage.RESOLVING_CONFLICTS);
            if (ctx.attemptGlobal() >= ctx.maxAttemptsGlobal()) {
                ctx.eventLog()
                        .append(
                                RunStage.RESOLVING_CONFLICTS,
                                "Maximum global resolution attempts exceeded",
                                100,
                                List.of(),
                                List.of("Could not resolve conflicts after maximum attempts"));
                fail("Maximum global resolution attempts exceeded");
                return;
            }
            ctx.incrementAttemptGlobal();
            ctx.eventLog()
                    .append(
                            RunStage.RESOLVING_CONFLICTS,
                            "Attempting to resolve conflicts (Global attempt %d/%d)"
                                    .formatted(ctx.attemptGlobal(), ctx.maxAttemptsGlobal()),
                            25,
                            ctx.conflictFiles(),
                            List.of());
            engine.runRound(ctx, (success, error) -> {
                if (success) {
                    ctx.mailbox().execute(this::detect);
                } else {
                    fail(error != null ? error : "Conflict resolution failed");
                }
            });
        }

        private void succeed() {
            if (!terminating.compareAndSet(false, true)) {
                return;
            }
            ctx.setStage(RunStage.COMPLETED);
            log(RunStage.COMPLETED, "Rebase of %s onto %s completed".formatted(ctx.sourceRef(), ctx.targetRef()), 100);
            ctx.recordOutcome(RunResult.succeeded());
            ctx.tracker().complete(RUN_OPERATION, true, null);
        }

        private void fail(String reason) {
            if (!terminating.compareAndSet(false, true)) {
                logger.debug("Run already finishing; ignoring failure: {}", reason);
                return;
            }
            try {
                ctx.setStage(RunStage.FAILED);
                // no agent may write into the tree after the reset
                var inFlight = ctx.inFlight();
                if (inFlight != null && !inFlight.isDone()) {
                    logger.debug("Cancelling in-flight agent call before rollback");
                    inFlight.cancel(true);
                }
                ctx.eventLog().append(RunStage.FAILED, "Rebase failed: " + firstLine(reason), 100, List.of(), List.of(reason));
                rollback.rollback(ctx);
            } catch (RuntimeException e) {
                logger.error("Rollback path threw", e);
            } finally {
                ctx.setStage(RunStage.FAILED);
                ctx.recordOutcome(RunResult.failed(reason));
                ctx.tracker().complete(RUN_OPERATION, false, reason);
            }
        }

        private void cancel() {
            if (terminating.get() || !ctx.markCancelled()) {
                return;
            }
            logger.info("Cancelling rebase of {} onto {}", ctx.sourceRef(), ctx.targetRef());
            var inFlight = ctx.inFlight();
            if (inFlight != null) {
                inFlight.cancel(true);
            }
            ctx.mailbox().execute(() -> fail("Rebase cancelled"));
        }

        /** Terminal callback of the tracker; fires once. */
        private void finish(boolean success, @Nullable String error) {
            var outcome = ctx.outcome();
            if (outcome != null) {
                success = outcome.success();
                error = outcome.error();
            }
            logger.info("Rebase of {} onto {} finished: {}", ctx.sourceRef(), ctx.targetRef(), success ? "success" : error);
            notifyComplete(listener, success, error);
            result.complete(new RunResult(success, error, ctx.eventLog().entries()));
        }

        private void log(RunStage stage, String details, int progress) {
            ctx.eventLog().append(stage, details, progress);
        }

        private String firstLine(String text) {
            int nl = text.indexOf('\n');
            return nl < 0 ? text : text.substring(0, nl);
        }
    }
}
