package forkpool.local.api.v1;

import forkpool.local.api.Controller;
import forkpool.local.api.v1.dto.HealthResponse;
import forkpool.local.pool.ExecutionPool;
import forkpool.local.process.ProcessRunner;
import forkpool.local.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/local/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final ExecutionPool<?> pool;
    private final ProcessRunner runner;

    public HealthController(ExecutionPool<?> pool, ProcessRunner runner) {
        this.pool = pool;
        this.runner = runner;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/local/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    pool.capacity(),
                    pool.runningCount(),
                    pool.waitingCount(),
                    runner.liveProcesses());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy()));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
