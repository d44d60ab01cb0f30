package foreman.coordinator.model;

/**
 * Worker lifecycle status.
 */
public enum WorkerStatus {
    /** Started through the runtime, no heartbeat seen yet */
    STARTING,
    /** Alive and waiting for work */
    IDLE,
    /** Holding exactly one task */
    BUSY,
    /** Missed heartbeats, about to be force-stopped */
    UNHEALTHY,
    /** Terminated */
    STOPPED
}
