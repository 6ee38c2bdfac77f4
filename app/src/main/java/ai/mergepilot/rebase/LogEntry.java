package ai.mergepilot.rebase;

import java.time.Instant;
import java.util.List;

/**
 * One immutable entry of a run's event log.
 *
 * @param progressPercent 0..100
 */
public record LogEntry(
        Instant timestamp,
        RunStage stage,
        String details,
        int progressPercent,
        List<String> files,
        List<String> errors) {
    public LogEntry {
        if (progressPercent < 0 || progressPercent > 100) {
            throw new IllegalArgumentException("progressPercent out of range: " + progressPercent);
        }
        files = List.copyOf(files);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Single-line rendering used for console output and log mirroring. */
    public String toDisplayString() {
        var sb = new StringBuilder();
        sb.append('[').append(stage.label()).append(' ').append(progressPercent).append("%] ").append(details);
        if (!errors.isEmpty()) {
            sb.append(" | errors: ").append(String.join(", ", errors));
        }
        return sb.toString();
    }
}
