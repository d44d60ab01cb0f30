package foreman.coordinator.exception;

import java.time.Duration;

/**
 * A worker stopped sending heartbeats. Raised by the health check for logging;
 * the pool manager handles it by force-stopping the worker.
 */
public class WorkerCrashException extends CoordinatorException {

    private final String workerId;

    public WorkerCrashException(String workerId, Duration silence) {
        super("Worker " + workerId + " missed heartbeats for " + silence.toMillis() + "ms");
        this.workerId = workerId;
    }

    public String workerId() {
        return workerId;
    }
}
