package forkpool.local.error;

/**
 * The task could not be started, e.g. the process could not be spawned.
 */
public class LaunchFailureException extends TaskExecutionException {

    public LaunchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
