package foreman.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for submitting a goal.
 * POST /api/v1/goals
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitGoalRequest(@JsonProperty("goal") String goal) {

    public void validate() {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal is required");
        }
    }
}
