package foreman.coordinator.worker;

import foreman.coordinator.model.ResourceUsage;

import java.time.Instant;

/**
 * Latest liveness signal of a worker, with its cumulative counters.
 */
public record Heartbeat(Instant at, ResourceUsage usage, int tasksCompleted, int tasksFailed) {

    public Heartbeat {
        usage = usage != null ? usage : ResourceUsage.NONE;
    }
}
