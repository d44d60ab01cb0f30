package foreman.coordinator.repository;

import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * The task store: authoritative task records and their dependency edges.
 * Implementations serialize every mutation so readers always see a consistent graph.
 */
public interface TaskRepository {

    /**
     * Insert a new task or update the descriptive fields of an existing one.
     * New tasks always enter as PENDING with zero attempts; for existing tasks
     * status, attempts, owner and creation order are kept.
     *
     * @throws foreman.coordinator.exception.UnknownDependencyException if a dependency does not exist
     * @throws foreman.coordinator.exception.DependencyCycleException    if the graph would become cyclic
     * @throws IllegalArgumentException if the dependencies of a task past PENDING would change
     */
    void upsert(Task task);

    /**
     * Upsert a batch atomically: dependencies may reference other tasks of the batch,
     * and if any task is rejected none of them is stored.
     */
    void upsertAll(List<Task> tasks);

    Optional<Task> findById(String taskId);

    /**
     * Tasks in creation order, filtered by status.
     *
     * @param statuses statuses to include; none means all
     */
    List<Task> findByStatus(TaskStatus... statuses);

    /**
     * Move a task to a new status.
     *
     * @throws foreman.coordinator.exception.InvalidTransitionException if the move is not legal
     * @throws foreman.coordinator.exception.TaskNotFoundException      if the task does not exist
     */
    Task transition(String taskId, TaskStatus next);

    /**
     * QUEUED -> IN_PROGRESS with exclusive ownership by {@code workerId}.
     */
    Task markInProgress(String taskId, String workerId);

    /**
     * IN_PROGRESS -> COMPLETED, recording the worker's detail and clearing the owner.
     */
    Task markCompleted(String taskId, String detail);

    /**
     * Move to FAILED, recording the reason and clearing the owner.
     * Counts an attempt when the task was queued or in progress.
     */
    Task markFailed(String taskId, String reason);

    int countByStatus(TaskStatus status);

    /** Immutable view of every task */
    TaskSnapshot snapshot();
}
