package forkpool.local.error;

/**
 * Base type for every way a pooled task can fail.
 * Always delivered as the failure cause of the future returned on submission.
 */
public abstract class TaskExecutionException extends RuntimeException {

    protected TaskExecutionException(String message) {
        super(message);
    }

    protected TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
