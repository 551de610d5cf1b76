package forkpool.local.config;

import java.time.Duration;

/**
 * Configuration holder for the local pool and its monitoring server.
 * All settings have sensible defaults.
 */
public final class PoolConfig {

    // Pool settings
    private int maxTasks = 4;
    private String shell = "sh";
    private Duration killGracePeriod = Duration.ofSeconds(5);

    // Server settings
    private int serverPort = 8888;
    private String serverHost = "0.0.0.0";
    private Duration statsInterval = Duration.ofSeconds(1);

    private PoolConfig() {
    }

    public static PoolConfig defaults() {
        return new PoolConfig();
    }

    public static PoolConfig fromEnv() {
        PoolConfig config = new PoolConfig();

        // Override from environment variables
        String maxTasks = System.getenv("FORKPOOL_MAX_TASKS");
        if (maxTasks != null && !maxTasks.isBlank()) {
            config.maxTasks = Integer.parseInt(maxTasks.trim());
        }

        String shell = System.getenv("FORKPOOL_SHELL");
        if (shell != null && !shell.isBlank()) {
            config.shell = shell.trim();
        }

        String killGraceMs = System.getenv("FORKPOOL_KILL_GRACE_MS");
        if (killGraceMs != null && !killGraceMs.isBlank()) {
            config.killGracePeriod = Duration.ofMillis(Long.parseLong(killGraceMs.trim()));
        }

        String port = System.getenv("FORKPOOL_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String host = System.getenv("FORKPOOL_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host.trim();
        }

        String statsMs = System.getenv("FORKPOOL_STATS_INTERVAL_MS");
        if (statsMs != null && !statsMs.isBlank()) {
            config.statsInterval = Duration.ofMillis(Long.parseLong(statsMs.trim()));
        }

        return config;
    }

    // Getters
    public int maxTasks() {
        return maxTasks;
    }

    public String shell() {
        return shell;
    }

    public Duration killGracePeriod() {
        return killGracePeriod;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration statsInterval() {
        return statsInterval;
    }

    // Fluent setters for testing/customization
    public PoolConfig withMaxTasks(int maxTasks) {
        this.maxTasks = maxTasks;
        return this;
    }

    public PoolConfig withShell(String shell) {
        this.shell = shell;
        return this;
    }

    public PoolConfig withKillGracePeriod(Duration gracePeriod) {
        this.killGracePeriod = gracePeriod;
        return this;
    }

    public PoolConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public PoolConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public PoolConfig withStatsInterval(Duration interval) {
        this.statsInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "maxTasks=" + maxTasks +
                ", shell='" + shell + '\'' +
                ", killGracePeriod=" + killGracePeriod +
                ", serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                '}';
    }
}
