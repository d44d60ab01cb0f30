package foreman.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Work queue wire format: what a worker needs to execute a task.
 */
public record TaskPayload(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("instruction") String instruction,
        @JsonProperty("branch") String branch,
        @JsonProperty("target_paths") List<String> targetPaths,
        @JsonProperty("priority") String priority) {

    public TaskPayload {
        targetPaths = targetPaths != null ? List.copyOf(targetPaths) : List.of();
    }
}
