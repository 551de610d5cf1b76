package forkpool.local.config;

import forkpool.local.api.v1.HealthController;
import forkpool.local.api.v1.LocalTasksController;
import forkpool.local.pool.ExecutionPool;
import forkpool.local.pool.LocalExecutionPool;
import forkpool.local.process.LocalPlatform;
import forkpool.local.process.ProcessRunner;
import forkpool.local.server.LocalPoolNettyServer;
import forkpool.local.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Manual dependency injection container.
 * Creates and wires the pool, the process runner and the monitoring server.
 *
 * Tasks are prioritised by an {@link Instant} context: the oldest first.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(PoolConfig.fromEnv());
 * deps.startServer();
 * deps.platform().fork(handle, streams);
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final PoolConfig config;
    private final ExecutionPool<Instant> pool;
    private final ProcessRunner runner;
    private final LocalPlatform<Instant> platform;

    // Controllers
    private final HealthController healthController;
    private final LocalTasksController localTasksController;

    // Router and server (lazy-initialized)
    private RouterHandler routerHandler;
    private LocalPoolNettyServer server;

    private Dependencies(PoolConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.pool = LocalExecutionPool.withNaturalOrder(config.maxTasks());
        this.runner = new ProcessRunner(config);
        this.platform = new LocalPlatform<>(pool, runner);

        this.healthController = new HealthController(pool, runner);
        this.localTasksController = new LocalTasksController(pool);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(PoolConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(PoolConfig.fromEnv());
    }

    // Getters
    public PoolConfig config() {
        return config;
    }

    public ExecutionPool<Instant> pool() {
        return pool;
    }

    public ProcessRunner runner() {
        return runner;
    }

    public LocalPlatform<Instant> platform() {
        return platform;
    }

    public HealthController healthController() {
        return healthController;
    }

    public LocalTasksController localTasksController() {
        return localTasksController;
    }

    /**
     * Get a RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(localTasksController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    /**
     * Get the monitoring server (creates it if not yet created).
     */
    public synchronized LocalPoolNettyServer server() {
        if (server == null) {
            server = new LocalPoolNettyServer(config, routerHandler(), pool);
        }
        return server;
    }

    /**
     * Start the monitoring server.
     *
     * @return false if the server could not bind
     */
    public boolean startServer() {
        return server().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop server first
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        // Kill whatever is still running
        try {
            runner.close();
        } catch (Exception e) {
            log.warn("Error closing process runner: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
