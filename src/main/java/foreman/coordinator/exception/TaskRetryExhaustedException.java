package foreman.coordinator.exception;

/**
 * A task failed with no attempts left. Recorded as the task's failure reason,
 * never thrown out of the scheduler.
 */
public class TaskRetryExhaustedException extends CoordinatorException {

    private final String taskId;
    private final int attempts;

    public TaskRetryExhaustedException(String taskId, int attempts, String lastError) {
        super("Task " + taskId + " exhausted " + attempts + " attempts"
                + (lastError != null ? ": " + lastError : ""));
        this.taskId = taskId;
        this.attempts = attempts;
    }

    public String taskId() {
        return taskId;
    }

    public int attempts() {
        return attempts;
    }
}
