package ai.mergepilot.rebase;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Final outcome of a run together with its complete event log. */
public record RunResult(boolean success, @Nullable String error, List<LogEntry> log) {
    public RunResult {
        log = List.copyOf(log);
    }

    static RunResult succeeded() {
        return new RunResult(true, null, List.of());
    }

    static RunResult failed(String error) {
        return new RunResult(false, error, List.of());
    }
}
