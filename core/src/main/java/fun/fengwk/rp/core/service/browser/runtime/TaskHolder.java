package fun.fengwk.rp.core.service.browser.runtime;

import java.util.concurrent.CompletableFuture;

/**
 * A queued browser task paired with its single-use reply slot.
 *
 * @param <T> task result type
 * @author fengwk
 */
final class TaskHolder<T> {

    private final BrowserTask<T> task;
    private final CompletableFuture<TaskResult<T>> reply = new CompletableFuture<>();

    TaskHolder(BrowserTask<T> task) {
        this.task = task;
    }

    BrowserTask<T> task() {
        return task;
    }

    CompletableFuture<TaskResult<T>> reply() {
        return reply;
    }

    /**
     * Run the task on the calling thread and write its outcome to the reply slot.
     */
    void run(BrowserSession session) {
        TaskResult<T> result;
        try {
            result = TaskResult.success(task.execute(session));
        } catch (Throwable ex) {
            // Errors are forwarded as well; the worker loop must outlive any single task.
            result = TaskResult.failure(ex);
        }
        reply.complete(result);
    }

    /**
     * Answer with a failure without running the task.
     */
    boolean reject(Throwable failure) {
        return reply.complete(TaskResult.failure(failure));
    }

}
