package forkpool.local.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes task output to the {@code forkpool.task} logger, one line per record,
 * prefixed by the task id.
 */
public final class Slf4jExecutionStreams implements ExecutionStreams {

    private static final Logger log = LoggerFactory.getLogger("forkpool.task");

    private final String taskId;

    public Slf4jExecutionStreams(String taskId) {
        this.taskId = taskId;
    }

    @Override
    public void debug(String text) {
        log.debug("[{}] {}", taskId, strip(text));
    }

    @Override
    public void info(String text) {
        log.info("[{}] {}", taskId, strip(text));
    }

    @Override
    public void error(String text) {
        log.warn("[{}] {}", taskId, strip(text));
    }

    // chunks usually end with the process' own newline
    private static String strip(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }
}
