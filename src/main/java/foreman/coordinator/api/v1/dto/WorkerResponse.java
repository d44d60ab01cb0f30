package foreman.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import foreman.coordinator.model.Worker;

import java.time.Instant;
import java.util.Locale;

/**
 * One worker of the pool.
 * GET/POST /api/v1/workers, DELETE /api/v1/workers/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("model") String model,
        @JsonProperty("status") String status,
        @JsonProperty("currentTaskId") String currentTaskId,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat,
        @JsonProperty("idleSince") Instant idleSince,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("tasksCompleted") int tasksCompleted,
        @JsonProperty("tasksFailed") int tasksFailed,
        @JsonProperty("tokens") long tokens,
        @JsonProperty("costUsd") double costUsd) {

    public static WorkerResponse from(Worker worker) {
        return new WorkerResponse(
                worker.id(),
                worker.model(),
                worker.status().name().toLowerCase(Locale.ROOT),
                worker.currentTaskId(),
                worker.lastHeartbeat(),
                worker.idleSince(),
                worker.startedAt(),
                worker.tasksCompleted(),
                worker.tasksFailed(),
                worker.usage().tokens(),
                worker.usage().costUsd());
    }
}
