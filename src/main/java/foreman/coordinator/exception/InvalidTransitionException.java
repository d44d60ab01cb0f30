package foreman.coordinator.exception;

import foreman.coordinator.model.TaskStatus;

/**
 * A status change outside the legal transition table. Indicates a programming defect.
 */
public class InvalidTransitionException extends CoordinatorException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        this(taskId, from, to, null);
    }

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to, String reason) {
        super("Task " + taskId + ": illegal transition " + from + " -> " + to
                + (reason != null ? " (" + reason + ")" : ""));
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }
}
