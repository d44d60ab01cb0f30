package foreman.coordinator.pool;

import foreman.coordinator.model.Worker;
import foreman.coordinator.model.WorkerStatus;

import java.util.List;

/**
 * Status view of the pool at one instant.
 */
public record PoolSnapshot(List<Worker> workers, int queueDepth, int ceiling, int floor, CostSummary cost) {

    public PoolSnapshot {
        workers = List.copyOf(workers);
    }

    public long count(WorkerStatus status) {
        return workers.stream().filter(w -> w.status() == status).count();
    }
}
