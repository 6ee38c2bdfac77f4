package ai.mergepilot.rebase;

import ai.mergepilot.git.RepoSnapshot;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jetbrains.annotations.Nullable;

/**
 * State of a single rebase run. Mutated only from the run's mailbox; the volatile and concurrent fields make the
 * read-only views on {@link RunHandle} safe to call from other threads.
 */
public final class RunContext {
    private final String sourceRef;
    private final String targetRef;
    private final int maxAttemptsGlobal;
    private final RepoSnapshot initialSnapshot;
    private final ProgressLog eventLog;
    private final AsyncOperationTracker tracker;
    private final Executor mailbox;

    private volatile int attemptGlobal;
    private final Map<String, Integer> fileAttempts = new ConcurrentHashMap<>();
    private volatile List<String> conflictFiles = List.of();
    private volatile RunStage stage = RunStage.INITIALIZING;
    // file -> errors, in first-failure order
    private final Map<String, List<String>> resolutionErrors = new LinkedHashMap<>();
    // file -> content with conflict markers, as first handed to the resolution agent this round
    private final Map<String, String> conflictedContent = new HashMap<>();

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile @Nullable CompletableFuture<?> inFlight;
    private volatile @Nullable RunResult outcome;

    RunContext(
            String sourceRef,
            String targetRef,
            int maxAttemptsGlobal,
            RepoSnapshot initialSnapshot,
            ProgressLog eventLog,
            AsyncOperationTracker tracker,
            Executor mailbox) {
        this.sourceRef = sourceRef;
        this.targetRef = targetRef;
        this.maxAttemptsGlobal = maxAttemptsGlobal;
        this.initialSnapshot = initialSnapshot;
        this.eventLog = eventLog;
        this.tracker = tracker;
        this.mailbox = mailbox;
    }

    public String sourceRef() {
        return sourceRef;
    }

    public String targetRef() {
        return targetRef;
    }

    public int maxAttemptsGlobal() {
        return maxAttemptsGlobal;
    }

    public RepoSnapshot initialSnapshot() {
        return initialSnapshot;
    }

    public ProgressLog eventLog() {
        return eventLog;
    }

    AsyncOperationTracker tracker() {
        return tracker;
    }

    /** Serial executor every continuation of this run is posted to. */
    Executor mailbox() {
        return mailbox;
    }

    public int attemptGlobal() {
        return attemptGlobal;
    }

    void incrementAttemptGlobal() {
        if (attemptGlobal >= maxAttemptsGlobal) {
            throw new IllegalStateException("Global attempt ceiling %d already reached".formatted(maxAttemptsGlobal));
        }
        attemptGlobal++;
    }

    public int fileAttempts(String path) {
        return fileAttempts.getOrDefault(path, 0);
    }

    /** Records a rejected verification for {@code path} and returns the new count. */
    int recordFileAttempt(String path) {
        return fileAttempts.merge(path, 1, Integer::sum);
    }

    public Map<String, Integer> fileAttempts() {
        return Map.copyOf(fileAttempts);
    }

    public List<String> conflictFiles() {
        return conflictFiles;
    }

    void replaceConflictFiles(List<String> files) {
        conflictFiles = List.copyOf(files);
    }

    public RunStage stage() {
        return stage;
    }

    void setStage(RunStage stage) {
        this.stage = stage;
    }

    void recordError(String path, String error) {
        resolutionErrors.computeIfAbsent(path, k -> new ArrayList<>()).add(error);
    }

    void clearResolutionErrors() {
        resolutionErrors.clear();
    }

    boolean hasResolutionErrors() {
        return !resolutionErrors.isEmpty();
    }

    Map<String, List<String>> resolutionErrors() {
        var copy = new LinkedHashMap<String, List<String>>();
        resolutionErrors.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }

    void rememberConflictedContent(String path, String content) {
        conflictedContent.put(path, content);
    }

    @Nullable
    String conflictedContent(String path) {
        return conflictedContent.get(path);
    }

    void clearConflictedContent() {
        conflictedContent.clear();
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /** Returns true only for the first call. */
    boolean markCancelled() {
        return cancelled.compareAndSet(false, true);
    }

    void setInFlight(@Nullable CompletableFuture<?> future) {
        this.inFlight = future;
    }

    @Nullable
    CompletableFuture<?> inFlight() {
        return inFlight;
    }

    /** The final outcome, recorded just before the run's own operation is completed. */
    @Nullable
    RunResult outcome() {
        return outcome;
    }

    void recordOutcome(RunResult outcome) {
        this.outcome = outcome;
    }
}
