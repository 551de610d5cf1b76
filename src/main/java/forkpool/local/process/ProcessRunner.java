package forkpool.local.process;

import forkpool.local.config.PoolConfig;
import forkpool.local.error.LaunchFailureException;
import forkpool.local.error.ProcessExitException;
import forkpool.local.error.TaskCancelledException;
import forkpool.local.pool.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs shell commands as local OS processes.
 *
 * Output is forwarded to the task's {@link ExecutionStreams} chunk by chunk as it
 * arrives: stdout to {@code info}, stderr to {@code error}. Cancellation sends a
 * graceful termination to the process and its descendants, then kills them
 * forcibly once the grace period has passed.
 */
public class ProcessRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    private static final int CHUNK_SIZE = 8192;

    private final String shell;
    private final Duration killGracePeriod;
    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService killer;
    private final Map<String, ProcessRecord> live = new ConcurrentHashMap<>();

    public ProcessRunner(PoolConfig config) {
        this(config.shell(), config.killGracePeriod());
    }

    public ProcessRunner(String shell, Duration killGracePeriod) {
        this.shell = shell;
        this.killGracePeriod = killGracePeriod;

        AtomicInteger ioThreads = new AtomicInteger();
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "forkpool-io-" + ioThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.killer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "forkpool-killer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start {@code command} and watch it until it exits.
     *
     * @return future completing on exit code 0, failing with
     *         {@link ProcessExitException} on any other code and with
     *         {@link TaskCancelledException} if the process was killed
     * @throws LaunchFailureException if the process cannot be spawned
     */
    public CompletableFuture<Void> run(String command, ExecutionStreams streams, CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(
                    new TaskCancelledException("Cancelled before the process was started: " + command));
        }

        Process process;
        try {
            process = new ProcessBuilder(shell, "-c", command).start();
        } catch (IOException e) {
            throw new LaunchFailureException("Failed to start process: " + command, e);
        }

        ProcessRecord record = new ProcessRecord(process);
        live.put(record.processId(), record);
        token.onCancelled(() -> kill(record));
        log.debug("Process {} started: {}", record.processId(), command);

        closeStdin(record);
        CompletableFuture<Void> stdout = pump(process.getInputStream(), streams::info);
        CompletableFuture<Void> stderr = pump(process.getErrorStream(), streams::error);

        CompletableFuture<Void> result = new CompletableFuture<>();
        process.onExit().whenComplete((exited, failure) -> {
            record.exitObserved = true;
            live.remove(record.processId());

            if (failure != null) {
                result.completeExceptionally(failure);
                return;
            }
            if (record.killRequested) {
                log.info("Process {} killed", record.processId());
                result.completeExceptionally(
                        new TaskCancelledException("Process " + record.processId() + " killed on cancellation"));
                return;
            }

            int exitCode = exited.exitValue();
            // resolve only once both streams have been forwarded completely
            CompletableFuture.allOf(stdout, stderr).whenComplete((ignored, pumpFailure) -> {
                if (pumpFailure != null) {
                    log.warn("Output of process {} not fully read: {}",
                            record.processId(), pumpFailure.getMessage());
                }
                if (exitCode == 0) {
                    result.complete(null);
                } else {
                    log.debug("Process {} exited with code {}", record.processId(), exitCode);
                    result.completeExceptionally(new ProcessExitException(exitCode));
                }
            });
        });
        return result;
    }

    /**
     * Number of processes started by this runner that have not exited yet.
     */
    public int liveProcesses() {
        return live.size();
    }

    /**
     * Kill every live process and stop the runner's threads.
     */
    @Override
    public void close() {
        for (ProcessRecord record : live.values()) {
            record.killRequested = true;
            forceKill(record, record.process.descendants().toList());
        }
        killer.shutdownNow();
        ioExecutor.shutdownNow();
    }

    private void kill(ProcessRecord record) {
        if (record.exitObserved) {
            return;
        }
        record.killRequested = true;
        Process process = record.process;
        List<ProcessHandle> descendants = process.descendants().toList();

        if (!process.supportsNormalTermination()) {
            forceKill(record, descendants);
            return;
        }

        log.debug("Terminating process {}", record.processId());
        descendants.forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            killer.schedule(() -> forceKill(record, descendants),
                    killGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Runner closed, killing process {} now", record.processId());
            forceKill(record, descendants);
        }
    }

    private void forceKill(ProcessRecord record, List<ProcessHandle> descendants) {
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        if (record.process.isAlive()) {
            log.warn("Process {} still alive, killing forcibly", record.processId());
            record.process.destroyForcibly();
        }
    }

    private CompletableFuture<Void> pump(InputStream in, Consumer<String> sink) {
        return CompletableFuture.runAsync(() -> {
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                char[] buffer = new char[CHUNK_SIZE];
                int n;
                while ((n = reader.read(buffer)) != -1) {
                    if (n > 0) {
                        sink.accept(new String(buffer, 0, n));
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, ioExecutor);
    }

    private static void closeStdin(ProcessRecord record) {
        try {
            record.process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of process {}: {}", record.processId(), e.getMessage());
        }
    }

    /**
     * Bookkeeping for one spawned process, dropped once its exit is observed.
     */
    static final class ProcessRecord {
        private final Process process;
        private final String processId;
        volatile boolean exitObserved;
        volatile boolean killRequested;

        ProcessRecord(Process process) {
            this.process = process;
            this.processId = String.valueOf(process.pid());
        }

        String processId() {
            return processId;
        }
    }
}
