package ai.mergepilot.rebase;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Pending-operation counter with a single-fire completion latch.
 *
 * <p>{@link #track} must be called before the dispatch it accounts for is issued. When {@link #complete} brings the
 * count back to zero the terminal callback fires, at most once for the lifetime of the tracker, with the outcome passed
 * to that call. The callback runs outside the lock so it may call back into the tracker.
 */
public final class AsyncOperationTracker {
    private static final Logger logger = LogManager.getLogger(AsyncOperationTracker.class);

    @FunctionalInterface
    public interface TerminalCallback {
        void onTerminal(boolean success, @Nullable String error);
    }

    private final TerminalCallback callback;
    private int pending;
    private boolean completed;

    public AsyncOperationTracker(TerminalCallback callback) {
        this.callback = callback;
    }

    public void track() {
        track("operation");
    }

    public synchronized void track(String operation) {
        if (completed) {
            logger.warn("Tracking {} after the run already completed", operation);
        }
        pending++;
        logger.trace("start {} (pending={})", operation, pending);
    }

    public void complete(boolean success, @Nullable String error) {
        complete("operation", success, error);
    }

    public void complete(String operation, boolean success, @Nullable String error) {
        boolean fire = false;
        synchronized (this) {
            if (pending <= 0) {
                logger.warn("Attempted to complete {} when no operations were pending", operation);
                pending = 0;
            } else {
                pending--;
            }
            logger.trace("complete {} (pending={}, success={}, error={})",
                         operation, pending, success, error == null ? "none" : error);
            if (pending == 0 && !completed) {
                completed = true;
                fire = true;
            }
        }
        if (fire) {
            callback.onTerminal(success, error);
        }
    }

    public synchronized int pending() {
        return pending;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }
}
