package forkpool.local.api.v1;

import forkpool.local.api.Controller;
import forkpool.local.api.v1.dto.TaskEntryResponse;
import forkpool.local.model.TaskStatus;
import forkpool.local.pool.ExecutionPool;
import forkpool.local.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Read-only view of the local pool.
 *
 * GET /api/local/tasks/running - tasks holding a slot
 * GET /api/local/tasks/waiting - queued tasks, in admission order
 */
public class LocalTasksController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(LocalTasksController.class);

    static final String RUNNING_PATH = "/api/local/tasks/running";
    static final String WAITING_PATH = "/api/local/tasks/waiting";

    private final ExecutionPool<?> pool;

    public LocalTasksController(ExecutionPool<?> pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (RUNNING_PATH.equals(path) || WAITING_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            List<TaskEntryResponse> entries = RUNNING_PATH.equals(path)
                    ? pool.listRunning().stream()
                            .map(h -> TaskEntryResponse.from(h, TaskStatus.RUNNING))
                            .toList()
                    : pool.listWaiting().stream()
                            .map(h -> TaskEntryResponse.from(h, TaskStatus.WAITING))
                            .toList();

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(entries));

        } catch (Exception e) {
            log.error("Local tasks controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
