package foreman.coordinator.decompose;

import foreman.coordinator.model.TaskDescription;

import java.util.List;

/**
 * Turns a goal into an ordered list of task descriptions.
 * Output is untrusted: the scheduler validates ids, priorities and dependency references
 * before anything reaches the task store.
 */
@FunctionalInterface
public interface Decomposer {

    /**
     * @throws IllegalArgumentException if the goal cannot be decomposed
     */
    List<TaskDescription> decompose(String goal);
}
