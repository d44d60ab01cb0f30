package foreman.coordinator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reconciliation loop states and the edges between them.
 */
public enum SchedulerState {
    IDLE,
    DISPATCHING,
    AWAITING_RESULTS,
    DONE,
    FAILED;

    private Set<SchedulerState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(DISPATCHING);
            case DISPATCHING -> EnumSet.of(AWAITING_RESULTS, DONE, FAILED);
            case AWAITING_RESULTS -> EnumSet.of(DISPATCHING, DONE, FAILED);
            case DONE, FAILED -> EnumSet.noneOf(SchedulerState.class);
        };
    }

    public boolean canTransitionTo(SchedulerState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
