package foreman.coordinator.worker;

/**
 * Runtime-issued reference to a started worker. Opaque to the pool beyond its ids.
 */
public record WorkerHandle(String workerId, String model, String runtimeRef) {
}
