package ai.mergepilot.rebase;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Append-only event log of a run. Entries are published to the sink in append order; the orchestrator never reads
 * the log back to make decisions.
 */
public final class ProgressLog {
    private static final Logger logger = LogManager.getLogger(ProgressLog.class);

    private final List<LogEntry> entries = new CopyOnWriteArrayList<>();
    private final Consumer<LogEntry> sink;
    private final Clock clock;

    public ProgressLog(Consumer<LogEntry> sink) {
        this(sink, Clock.systemUTC());
    }

    ProgressLog(Consumer<LogEntry> sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
    }

    public LogEntry append(RunStage stage, String details, int progress) {
        return append(stage, details, progress, List.of(), List.of());
    }

    public LogEntry append(RunStage stage, String details, int progress, List<String> files, List<String> errors) {
        var entry = new LogEntry(clock.instant(), stage, details, progress, files, errors);
        entries.add(entry);
        logger.debug(entry.toDisplayString());
        try {
            sink.accept(entry);
        } catch (RuntimeException e) {
            logger.warn("Log listener threw while handling entry '{}'", details, e);
        }
        return entry;
    }

    /** Snapshot of the entries appended so far. */
    public List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
