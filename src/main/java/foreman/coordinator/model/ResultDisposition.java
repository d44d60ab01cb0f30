package foreman.coordinator.model;

/**
 * What the scheduler did with a result report.
 */
public enum ResultDisposition {
    /** Task marked COMPLETED */
    COMPLETED,

    /** Task failed and was re-queued */
    RETRIED,

    /** Task failed with no attempts left */
    FAILED,

    /** Report did not match the current owner or the task was not in progress */
    STALE,

    /** Task not found */
    NOT_FOUND
}
