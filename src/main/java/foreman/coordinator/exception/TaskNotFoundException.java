package foreman.coordinator.exception;

public class TaskNotFoundException extends CoordinatorException {

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
    }
}
