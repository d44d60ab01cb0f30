package foreman.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import foreman.coordinator.pool.CostSummary;
import foreman.coordinator.pool.PoolSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Pool status snapshot.
 * GET /api/v1/workers
 */
public record PoolStatusResponse(
        @JsonProperty("workers") List<WorkerResponse> workers,
        @JsonProperty("queueDepth") int queueDepth,
        @JsonProperty("ceiling") int ceiling,
        @JsonProperty("floor") int floor,
        @JsonProperty("cost") Cost cost) {

    public record Cost(
            @JsonProperty("totalCostUsd") double totalCostUsd,
            @JsonProperty("totalTokens") long totalTokens,
            @JsonProperty("budgetUsd") double budgetUsd,
            @JsonProperty("budgetExhausted") boolean budgetExhausted,
            @JsonProperty("workersByModel") Map<String, Integer> workersByModel) {

        static Cost from(CostSummary summary) {
            return new Cost(summary.totalCostUsd(), summary.totalTokens(), summary.budgetUsd(),
                    summary.budgetExhausted(), summary.workersByModel());
        }
    }

    public static PoolStatusResponse from(PoolSnapshot snapshot) {
        return new PoolStatusResponse(
                snapshot.workers().stream().map(WorkerResponse::from).toList(),
                snapshot.queueDepth(),
                snapshot.ceiling(),
                snapshot.floor(),
                Cost.from(snapshot.cost()));
    }
}
