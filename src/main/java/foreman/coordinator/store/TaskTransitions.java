package foreman.coordinator.store;

import foreman.coordinator.exception.InvalidTransitionException;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskStatus;

import java.time.Instant;

/**
 * Pure record-level state changes, applied identically by every task store.
 */
final class TaskTransitions {

    private TaskTransitions() {
    }

    /** A record entering the store for the first time */
    static Task created(Task incoming, long sequence, Instant now) {
        return incoming.toBuilder()
                .status(TaskStatus.PENDING)
                .attempts(0)
                .assignedTo(null)
                .lastError(null)
                .result(null)
                .sequence(sequence)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Dependencies may only change while the task is still PENDING. Once queued it was
     * released against its old dependencies, so a new edge could point at unfinished work.
     *
     * @throws IllegalArgumentException if {@code incoming} changes the dependencies of a task past PENDING
     */
    static void checkReplaceable(Task existing, Task incoming) {
        if (existing.status() != TaskStatus.PENDING
                && !existing.dependencies().equals(incoming.dependencies())) {
            throw new IllegalArgumentException("Cannot change dependencies of task " + existing.id()
                    + " in status " + existing.status() + ": " + existing.dependencies()
                    + " -> " + incoming.dependencies());
        }
    }

    /** Replace descriptive fields, keep lifecycle fields */
    static Task merged(Task existing, Task incoming, Instant now) {
        return existing.toBuilder()
                .title(incoming.title())
                .instruction(incoming.instruction())
                .targetPaths(incoming.targetPaths())
                .branch(incoming.branch())
                .priority(incoming.priority())
                .dependencies(incoming.dependencies())
                .maxAttempts(incoming.maxAttempts())
                .updatedAt(now)
                .build();
    }

    static Task moved(Task current, TaskStatus next, Instant now) {
        check(current, next);
        if (current.status() == TaskStatus.FAILED && next == TaskStatus.QUEUED && !current.canRetry()) {
            throw new InvalidTransitionException(current.id(), current.status(), next,
                    "no attempts left (" + current.attempts() + "/" + current.maxAttempts() + ")");
        }
        Task.Builder builder = current.toBuilder().status(next).updatedAt(now);
        if (next != TaskStatus.IN_PROGRESS) {
            builder.assignedTo(null);
        }
        return builder.build();
    }

    static Task inProgress(Task current, String workerId, Instant now) {
        check(current, TaskStatus.IN_PROGRESS);
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        return current.toBuilder()
                .status(TaskStatus.IN_PROGRESS)
                .assignedTo(workerId)
                .updatedAt(now)
                .build();
    }

    static Task completed(Task current, String detail, Instant now) {
        check(current, TaskStatus.COMPLETED);
        return current.toBuilder()
                .status(TaskStatus.COMPLETED)
                .assignedTo(null)
                .result(detail)
                .lastError(null)
                .updatedAt(now)
                .build();
    }

    static Task failed(Task current, String reason, Instant now) {
        check(current, TaskStatus.FAILED);
        boolean consumedAttempt = current.status() == TaskStatus.IN_PROGRESS
                || current.status() == TaskStatus.QUEUED;
        return current.toBuilder()
                .status(TaskStatus.FAILED)
                .assignedTo(null)
                .attempts(consumedAttempt ? current.attempts() + 1 : current.attempts())
                .lastError(reason)
                .updatedAt(now)
                .build();
    }

    private static void check(Task current, TaskStatus next) {
        if (!current.status().canTransitionTo(next)) {
            throw new InvalidTransitionException(current.id(), current.status(), next);
        }
    }
}
