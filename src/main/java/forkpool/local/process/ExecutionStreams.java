package forkpool.local.process;

/**
 * Per-task log sink. Calls are fire-and-forget and must not block the caller.
 */
public interface ExecutionStreams {

    void debug(String text);

    /** Process stdout */
    void info(String text);

    /** Process stderr */
    void error(String text);
}
