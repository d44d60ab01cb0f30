package foreman.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("scheduler") String scheduler,
        @JsonProperty("failureReason") String failureReason,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("tasks") Map<String, Integer> tasks,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("queueDepth") Integer queueDepth,
        @JsonProperty("pendingGoals") Integer pendingGoals) {

    public static HealthResponse healthy(String scheduler, String failureReason, String database, String uptime,
            String version, Map<String, Integer> tasks, int workers, int queueDepth, int pendingGoals) {
        return new HealthResponse("healthy", scheduler, failureReason, database, uptime, version,
                tasks, workers, queueDepth, pendingGoals);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", null, null, database, null, null, null, null, null, null);
    }
}
