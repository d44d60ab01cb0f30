package foreman.coordinator.worker;

import java.util.Objects;

/**
 * What the pool asks the runtime to start.
 */
public record WorkerSpec(String workerId, String model) {

    public WorkerSpec {
        Objects.requireNonNull(workerId, "workerId is required");
    }
}
