package forkpool.local.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import forkpool.local.model.TaskHandle;
import forkpool.local.model.TaskStatus;

/**
 * One running or waiting task.
 * GET /api/local/tasks/running, GET /api/local/tasks/waiting
 */
public record TaskEntryResponse(
        @JsonProperty("id") String id,
        @JsonProperty("command") String command,
        @JsonProperty("execution") ExecutionResponse execution) {

    public static TaskEntryResponse from(TaskHandle<?> handle, TaskStatus status) {
        return new TaskEntryResponse(
                handle.id(),
                handle.command(),
                ExecutionResponse.from(handle, status));
    }
}
