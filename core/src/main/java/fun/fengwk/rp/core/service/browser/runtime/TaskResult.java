package fun.fengwk.rp.core.service.browser.runtime;

/**
 * Outcome of one browser task: either the computed value or the captured failure.
 *
 * <p>The failure is carried as data from the worker thread to the submitter and re-thrown
 * there unchanged, so the submitter observes the same exception type, message and instance
 * as if it had run the task itself.
 *
 * @param <T> value type
 * @author fengwk
 */
public final class TaskResult<T> {

    private final boolean success;
    private final T value;
    private final Throwable failure;

    private TaskResult(boolean success, T value, Throwable failure) {
        this.success = success;
        this.value = value;
        this.failure = failure;
    }

    public static <T> TaskResult<T> success(T value) {
        return new TaskResult<>(true, value, null);
    }

    public static <T> TaskResult<T> failure(Throwable failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new TaskResult<>(false, null, failure);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getValue() {
        return value;
    }

    public Throwable getFailure() {
        return failure;
    }

    public String getFailureKind() {
        return failure == null ? null : failure.getClass().getName();
    }

    public String getFailureMessage() {
        return failure == null ? null : failure.getMessage();
    }

    public T getOrThrow() throws Exception {
        if (success) {
            return value;
        }
        if (failure instanceof Exception ex) {
            throw ex;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException(failure.getMessage(), failure);
    }

    @Override
    public String toString() {
        return success
            ? "TaskResult{success, value=" + value + "}"
            : "TaskResult{failure, kind=" + getFailureKind() + ", message=" + getFailureMessage() + "}";
    }

}
