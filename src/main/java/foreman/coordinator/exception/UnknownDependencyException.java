package foreman.coordinator.exception;

/**
 * A task references a dependency id that does not exist.
 */
public class UnknownDependencyException extends CoordinatorException {

    private final String taskId;
    private final String dependencyId;

    public UnknownDependencyException(String taskId, String dependencyId) {
        super("Task " + taskId + " depends on unknown task " + dependencyId);
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public String taskId() {
        return taskId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
