package fun.fengwk.rp.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Browser worker that owns the browser session and runs queued tasks one at a time.
 *
 * <p>The session is created on the worker thread before the loop starts and is never exposed
 * to any other thread. Tasks run strictly in mailbox order; a failing task is answered with its
 * failure and the loop moves on to the next task.
 *
 * @author fengwk
 */
public class BrowserWorker {

    private static final Logger log = LoggerFactory.getLogger(BrowserWorker.class);

    private static final TaskHolder<Void> STOP = new TaskHolder<>(session -> null);

    private final String threadName;
    private final BrowserSessionFactory sessionFactory;
    private final TaskMailbox mailbox;
    private final CompletableFuture<Void> started = new CompletableFuture<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile WorkerState state = WorkerState.STARTING;
    private volatile Thread thread;

    /**
     * Only touched on the worker thread.
     */
    private BrowserSession session;

    BrowserWorker(String threadName, BrowserSessionFactory sessionFactory, TaskMailbox mailbox) {
        this.threadName = threadName;
        this.sessionFactory = sessionFactory;
        this.mailbox = mailbox;
    }

    /**
     * Start the worker thread and wait until the session is created.
     *
     * @throws Exception the session creation failure
     */
    void start() throws Exception {
        Thread workerThread = new Thread(this::run, threadName);
        workerThread.setDaemon(true);
        thread = workerThread;
        workerThread.start();
        try {
            started.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("failed to start browser worker", cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            shutdown(0);
            throw new IllegalStateException("interrupted while starting browser worker", ex);
        }
    }

    public WorkerState getState() {
        return state;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public boolean isTerminated() {
        return state == WorkerState.TERMINATED;
    }

    public boolean isWorkerThread() {
        return Thread.currentThread() == thread;
    }

    int pendingTasks() {
        return mailbox.size();
    }

    void enqueue(TaskHolder<?> holder) {
        mailbox.enqueue(holder);
        if (isTerminated()) {
            // The loop is gone, nothing will ever take this task.
            rejectPending();
        }
    }

    /**
     * Run a task submitted from inside another task. The outer task is still the only one
     * executing, so running inline keeps tasks serialized.
     */
    <T> void runNested(TaskHolder<T> holder) {
        if (!isWorkerThread()) {
            throw new IllegalStateException("nested tasks must run on the browser worker thread");
        }
        holder.run(session);
    }

    /**
     * Stop accepting work, fail pending tasks and close the session on the worker thread.
     *
     * @param joinTimeoutMs how long to wait for the worker thread, 0 means do not wait
     */
    void shutdown(long joinTimeoutMs) {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("shutting down browser worker, thread={}, pending={}", threadName, mailbox.size());
        rejectPending();
        mailbox.enqueue(STOP);

        Thread workerThread = thread;
        if (joinTimeoutMs <= 0 || workerThread == null || workerThread == Thread.currentThread()) {
            return;
        }
        try {
            workerThread.join(joinTimeoutMs);
            if (workerThread.isAlive()) {
                log.warn("browser worker did not stop in time, thread={}, timeoutMs={}", threadName, joinTimeoutMs);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for browser worker to stop, thread={}", threadName);
        }
    }

    private void run() {
        try {
            session = sessionFactory.create();
        } catch (Throwable ex) {
            log.warn("failed to create browser session, thread={}, error={}", threadName, ex.getMessage(), ex);
            state = WorkerState.TERMINATED;
            started.completeExceptionally(ex);
            return;
        }

        state = WorkerState.IDLE;
        started.complete(null);
        log.info("browser worker started, thread={}", threadName);
        try {
            loop();
        } finally {
            closeSession();
            state = WorkerState.TERMINATED;
            rejectPending();
            log.info("browser worker stopped, thread={}", threadName);
        }
    }

    private void loop() {
        while (true) {
            state = WorkerState.IDLE;
            TaskHolder<?> holder;
            try {
                holder = mailbox.take();
            } catch (InterruptedException ex) {
                if (shutdown.get()) {
                    return;
                }
                log.warn("browser worker interrupted while idle, thread={}", threadName);
                continue;
            }
            if (holder == STOP) {
                return;
            }

            state = WorkerState.EXECUTING;
            long startAt = System.currentTimeMillis();
            holder.run(session);
            if (log.isDebugEnabled()) {
                log.debug(
                    "browser task finished, task={}, elapsedMs={}, pending={}",
                    holder.task().getClass().getName(),
                    System.currentTimeMillis() - startAt,
                    mailbox.size()
                );
            }
            // A task may leave the interrupt flag set, it must not leak into the next take.
            Thread.interrupted();
        }
    }

    private void rejectPending() {
        for (TaskHolder<?> pending : mailbox.drain()) {
            if (pending != STOP) {
                pending.reject(new IllegalStateException("browser worker is shutting down"));
            }
        }
    }

    private void closeSession() {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (Exception ex) {
            log.warn("failed to close browser session, thread={}", threadName, ex);
        }
    }

}
