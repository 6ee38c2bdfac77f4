package ai.mergepilot.rebase;

import org.jetbrains.annotations.Nullable;

/**
 * Receives the events of a run. {@link #onComplete} is called exactly once. Callbacks run on whichever thread is
 * driving the run and should return quickly.
 */
public interface RunListener {
    void onComplete(boolean success, @Nullable String error);

    default void onLog(LogEntry entry) {}
}
