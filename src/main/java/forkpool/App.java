package forkpool;

import forkpool.local.config.Dependencies;
import forkpool.local.config.PoolConfig;
import forkpool.local.error.ProcessExitException;
import forkpool.local.model.TaskHandle;
import forkpool.local.process.Slf4jExecutionStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Without arguments: starts the monitoring server and waits until the JVM is stopped.
 * With arguments: runs every argument as a shell command through the pool, in order,
 * and exits with 0 if all of them succeeded.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        PoolConfig config = PoolConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        if (args.length > 0) {
            int status = runCommands(deps, args);
            deps.close();
            System.exit(status);
        }

        if (!deps.startServer()) {
            log.error("Server did not start on port {}", config.serverPort());
            deps.close();
            System.exit(1);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            deps.close();
            stopped.countDown();
        }, "forkpool-shutdown"));
        stopped.await();
    }

    private static int runCommands(Dependencies deps, String[] commands) {
        Instant base = Instant.now();
        List<CompletableFuture<Void>> results = new ArrayList<>();
        for (int i = 0; i < commands.length; i++) {
            TaskHandle<Instant> handle = TaskHandle.<Instant>builder()
                    .command(commands[i])
                    .context(base.plusNanos(i))
                    .jobId("cli")
                    .build();
            results.add(deps.platform().fork(handle, new Slf4jExecutionStreams(handle.id())));
        }

        int failed = 0;
        for (int i = 0; i < results.size(); i++) {
            try {
                results.get(i).join();
            } catch (CompletionException e) {
                failed++;
                Throwable cause = e.getCause();
                if (cause instanceof ProcessExitException exit) {
                    log.warn("Command '{}' exited with code {}", commands[i], exit.exitCode());
                } else {
                    log.warn("Command '{}' failed: {}", commands[i], cause.getMessage());
                }
            }
        }
        log.info("{} of {} commands succeeded", commands.length - failed, commands.length);
        return failed == 0 ? 0 : 1;
    }
}
