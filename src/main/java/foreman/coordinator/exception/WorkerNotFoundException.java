package foreman.coordinator.exception;

public class WorkerNotFoundException extends CoordinatorException {

    private final String workerId;

    public WorkerNotFoundException(String workerId) {
        super("Worker not found: " + workerId);
        this.workerId = workerId;
    }

    public String workerId() {
        return workerId;
    }
}
