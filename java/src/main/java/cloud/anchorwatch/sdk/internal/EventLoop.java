package cloud.anchorwatch.sdk.internal;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded cooperative loop on which every reaction of a pairing client runs: store watch callbacks,
 * role transition notifications, throttle timers and self-healing work. Tasks never run concurrently with each
 * other, so state touched only from the loop needs no further locking.
 *
 * <p>After {@link #close()} new tasks are dropped and pending ones are cancelled. Long running tasks should
 * consult {@link #isClosed()} between steps.</p>
 */
public final class EventLoop implements Executor, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(EventLoop.class.getName());

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;
    private volatile boolean closed;

    public EventLoop(String name) {
        Objects.requireNonNull(name, "name");
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (closed) {
            LOGGER.fine(() -> "[anchorwatch] event loop closed; dropping task");
            return;
        }
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException ex) {
            LOGGER.fine(() -> "[anchorwatch] event loop rejected task after shutdown");
        }
    }

    /**
     * Runs {@code task} after {@code delay}. The returned handle cancels the task; it is {@code null} when the loop
     * is already closed.
     */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task");
        if (closed) {
            return null;
        }
        long millis = delay == null || delay.isNegative() ? 0L : delay.toMillis();
        try {
            return executor.schedule(guard(task), millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            return null;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdownNow();
    }

    private Runnable guard(Runnable task) {
        return () -> {
            if (closed) {
                return;
            }
            try {
                task.run();
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] event loop task failed", ex);
            }
        };
    }
}
