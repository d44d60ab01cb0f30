package foreman.coordinator.pool;

import java.util.List;

/**
 * What one auto-scaling pass saw and did.
 */
public record ScaleDecision(int queueDepth, int current, int desired, List<String> spawned, List<String> stopped) {

    public ScaleDecision {
        spawned = List.copyOf(spawned);
        stopped = List.copyOf(stopped);
    }

    public boolean isNoop() {
        return spawned.isEmpty() && stopped.isEmpty();
    }
}
