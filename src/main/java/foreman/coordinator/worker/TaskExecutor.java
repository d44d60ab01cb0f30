package foreman.coordinator.worker;

import foreman.coordinator.model.TaskPayload;

/**
 * The work done inside a task. Opaque to the coordinator: it only sees the outcome.
 * Throwing counts as a failed execution.
 */
@FunctionalInterface
public interface TaskExecutor {

    Execution execute(TaskPayload task, WorkerSpec worker) throws Exception;
}
