package forkpool.local.error;

/**
 * The process ran to completion with a non-zero exit status.
 */
public class ProcessExitException extends TaskExecutionException {

    private final int exitCode;

    public ProcessExitException(int exitCode) {
        super("Process exited with code " + exitCode);
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
