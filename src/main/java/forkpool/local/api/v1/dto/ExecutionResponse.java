package forkpool.local.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import forkpool.local.model.TaskHandle;
import forkpool.local.model.TaskStatus;

import java.time.Instant;

/**
 * Execution details of a pooled task, nested in {@link TaskEntryResponse}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        @JsonProperty("executionId") String executionId,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("context") String context,
        @JsonProperty("status") String status,
        @JsonProperty("submittedAt") Instant submittedAt) {

    public static ExecutionResponse from(TaskHandle<?> handle, TaskStatus status) {
        return new ExecutionResponse(
                handle.executionId(),
                handle.jobId(),
                String.valueOf(handle.context()),
                status.name(),
                handle.submittedAt());
    }
}
