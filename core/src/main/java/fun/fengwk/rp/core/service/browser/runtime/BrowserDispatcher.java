package fun.fengwk.rp.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-facing handle of the browser worker.
 *
 * <p>{@link #submit(BrowserTask)} may be called from any thread. Each call enqueues exactly one
 * task with its own reply slot and blocks until the worker has run it, then returns the value
 * or re-throws the task's own failure.
 *
 * @author fengwk
 */
public class BrowserDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BrowserDispatcher.class);

    private final BrowserWorker worker;
    private final long defaultTimeoutMs;

    BrowserDispatcher(BrowserWorker worker, long defaultTimeoutMs) {
        this.worker = worker;
        this.defaultTimeoutMs = Math.max(0L, defaultTimeoutMs);
    }

    public <T> T submit(BrowserTask<T> task) throws Exception {
        if (defaultTimeoutMs > 0) {
            return submit(task, Duration.ofMillis(defaultTimeoutMs));
        }
        TaskHolder<T> holder = dispatch(task);
        TaskResult<T> result;
        try {
            result = holder.reply().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for browser task", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("browser task reply failed", ex.getCause());
        }
        return result.getOrThrow();
    }

    /**
     * Submit a task and wait at most {@code timeout} for its result.
     *
     * <p>A timeout only stops the wait. The task stays queued or keeps running on the worker.
     *
     * @throws TimeoutException if the result is not available in time
     */
    public <T> T submit(BrowserTask<T> task, Duration timeout) throws Exception {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be null or negative");
        }
        long timeoutMs = toMillis(timeout);
        TaskHolder<T> holder = dispatch(task);
        TaskResult<T> result;
        try {
            result = holder.reply().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.info(
                "browser task wait timeout, task={}, timeoutMs={}, pending={}",
                task.getClass().getName(),
                timeoutMs,
                worker.pendingTasks()
            );
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for browser task", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("browser task reply failed", ex.getCause());
        }
        return result.getOrThrow();
    }

    public WorkerState getWorkerState() {
        return worker.getState();
    }

    BrowserWorker worker() {
        return worker;
    }

    /**
     * Durations beyond the millisecond range mean waiting without limit.
     */
    private static long toMillis(Duration timeout) {
        try {
            return timeout.toMillis();
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    private <T> TaskHolder<T> dispatch(BrowserTask<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("browser task must not be null");
        }
        TaskHolder<T> holder = new TaskHolder<>(task);
        if (worker.isWorkerThread()) {
            worker.runNested(holder);
            return holder;
        }
        if (worker.isShutdown()) {
            throw new IllegalStateException("browser worker is shutdown");
        }
        worker.enqueue(holder);
        return holder;
    }

}
