package forkpool.local.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/local/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("capacity") Integer capacity,
        @JsonProperty("runningTasks") Integer runningTasks,
        @JsonProperty("waitingTasks") Integer waitingTasks,
        @JsonProperty("liveProcesses") Integer liveProcesses) {

    public static HealthResponse healthy(String uptime, String version, int capacity, int runningTasks,
            int waitingTasks, int liveProcesses) {
        return new HealthResponse("healthy", uptime, version, capacity, runningTasks, waitingTasks,
                liveProcesses);
    }

    public static HealthResponse unhealthy() {
        return new HealthResponse("unhealthy", null, null, null, null, null, null);
    }
}
