package forkpool.local.process;

import forkpool.local.model.TaskHandle;
import forkpool.local.pool.ExecutionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for schedulers that run shell commands locally.
 * Commands wait for a slot in the {@link ExecutionPool} and are then
 * started by the {@link ProcessRunner}.
 *
 * Usage:
 *
 * <pre>
 * TaskHandle&lt;Instant&gt; handle = TaskHandle.&lt;Instant&gt;builder()
 *         .command("make test")
 *         .context(Instant.now())
 *         .jobId("nightly")
 *         .build();
 * platform.fork(handle, new Slf4jExecutionStreams(handle.id()))
 *         .whenComplete((ok, failure) -&gt; ...);
 * </pre>
 */
public class LocalPlatform<C> {

    private static final Logger log = LoggerFactory.getLogger(LocalPlatform.class);

    private final ExecutionPool<C> pool;
    private final ProcessRunner runner;

    public LocalPlatform(ExecutionPool<C> pool, ProcessRunner runner) {
        this.pool = pool;
        this.runner = runner;
    }

    /**
     * Queue the handle's command and run it once a slot is free.
     *
     * @return future completing when the process exits with code 0
     */
    public CompletableFuture<Void> fork(TaskHandle<C> handle, ExecutionStreams streams) {
        streams.debug("Waiting available resources to fork:");
        streams.debug(handle.command());
        streams.debug("...");

        return pool.submit(handle, token -> {
            streams.debug("Running");
            log.debug("Forking task {}", handle.id());
            return runner.run(handle.command(), streams, token);
        });
    }

    /**
     * Cancel a queued or running task.
     *
     * @return false if the task is not in the pool any more
     */
    public boolean cancel(TaskHandle<C> handle) {
        return pool.cancel(handle);
    }

    public ExecutionPool<C> pool() {
        return pool;
    }

    public ProcessRunner runner() {
        return runner;
    }
}
