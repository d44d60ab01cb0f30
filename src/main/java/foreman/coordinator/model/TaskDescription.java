package foreman.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One task as returned by a decomposer. Untrusted until the task store accepts it.
 * {@code dependsOn} references ids of other descriptions in the same batch or of stored tasks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskDescription(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("instruction") String instruction,
        @JsonProperty("branch") String branch,
        @JsonProperty("target_paths") List<String> targetPaths,
        @JsonProperty("priority") String priority,
        @JsonProperty("depends_on") List<String> dependsOn) {

    public TaskDescription {
        targetPaths = targetPaths != null ? List.copyOf(targetPaths) : List.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }
}
