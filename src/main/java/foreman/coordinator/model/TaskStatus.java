package foreman.coordinator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task execution status.
 *
 * <pre>
 * PENDING -> QUEUED -> IN_PROGRESS -> COMPLETED | FAILED
 * FAILED  -> QUEUED                  (retry, only while attempts remain)
 * PENDING -> FAILED                  (a dependency failed terminally)
 * QUEUED  -> FAILED                  (delivery lost before it was claimed)
 * </pre>
 */
public enum TaskStatus {
    /** Created, waiting for its dependencies */
    PENDING,
    /** Pushed onto the work queue */
    QUEUED,
    /** Claimed by exactly one worker */
    IN_PROGRESS,
    /** Finished successfully */
    COMPLETED,
    /** Failed; may be re-queued while attempts remain */
    FAILED;

    private Set<TaskStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(QUEUED, FAILED);
            case QUEUED -> EnumSet.of(IN_PROGRESS, FAILED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED);
            case FAILED -> EnumSet.of(QUEUED);
            case COMPLETED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus next) {
        return successors().contains(next);
    }

    /** Pending, queued or in progress: the scheduler still has work to do. */
    public boolean isActive() {
        return this == PENDING || this == QUEUED || this == IN_PROGRESS;
    }
}
