package forkpool.local.error;

/**
 * The task was cancelled by explicit request, either while still queued
 * or after its process had been started.
 */
public class TaskCancelledException extends TaskExecutionException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
