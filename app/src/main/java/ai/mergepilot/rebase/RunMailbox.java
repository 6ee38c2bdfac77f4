package ai.mergepilot.rebase;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serial executor for the continuations of one run. Tasks run one at a time, in submission order, on whichever thread
 * happens to be draining; a task submitted from inside another task is queued rather than run recursively. No threads
 * are created.
 *
 * <p>A {@link RuntimeException} escaping a task is handed to the failure handler and the drain continues.
 */
final class RunMailbox implements Executor {
    private static final Logger logger = LogManager.getLogger(RunMailbox.class);

    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();
    private final Consumer<RuntimeException> failureHandler;

    RunMailbox(Consumer<RuntimeException> failureHandler) {
        this.failureHandler = failureHandler;
    }

    @Override
    public void execute(Runnable task) {
        queue.add(task);
        if (wip.getAndIncrement() != 0) {
            return;
        }
        do {
            var next = queue.poll();
            assert next != null;
            runTask(next);
        } while (wip.decrementAndGet() != 0);
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in rebase run continuation", e);
            try {
                failureHandler.accept(e);
            } catch (RuntimeException nested) {
                logger.error("Failure handler threw", nested);
            }
        }
    }
}
