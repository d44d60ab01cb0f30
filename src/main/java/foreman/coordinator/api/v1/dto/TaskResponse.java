package foreman.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import foreman.coordinator.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Read-only view of a task record.
 * GET /api/v1/tasks, GET /api/v1/tasks/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("instruction") String instruction,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("branch") String branch,
        @JsonProperty("target_paths") List<String> targetPaths,
        @JsonProperty("depends_on") List<String> dependsOn,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("assignedTo") String assignedTo,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("result") String result,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.title(),
                task.instruction(),
                task.status().name().toLowerCase(Locale.ROOT),
                task.priority().wireName(),
                task.branch(),
                task.targetPaths(),
                List.copyOf(task.dependencies()),
                task.attempts(),
                task.maxAttempts(),
                task.assignedTo(),
                task.lastError(),
                task.result(),
                task.createdAt(),
                task.updatedAt());
    }
}
