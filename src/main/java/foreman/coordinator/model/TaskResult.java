package foreman.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result channel wire format: one completion or failure report from a worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("outcome") Outcome outcome,
        @JsonProperty("detail") String detail,
        @JsonProperty("usage") ResourceUsage usage) {

    public TaskResult {
        Objects.requireNonNull(taskId, "task_id is required");
        Objects.requireNonNull(workerId, "worker_id is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public static TaskResult completed(String taskId, String workerId, String detail) {
        return new TaskResult(taskId, workerId, Outcome.COMPLETED, detail, null);
    }

    public static TaskResult failed(String taskId, String workerId, String detail) {
        return new TaskResult(taskId, workerId, Outcome.FAILED, detail, null);
    }

    public TaskResult withUsage(ResourceUsage usage) {
        return new TaskResult(taskId, workerId, outcome, detail, usage);
    }
}
