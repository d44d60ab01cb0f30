package foreman.coordinator.scheduler;

import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure functions over a task snapshot: which pending tasks may run now,
 * and which never will.
 */
public final class DependencyResolver {

    /** Dispatch order: priority first, then creation order */
    public static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparing(Task::priority)
            .thenComparingLong(Task::sequence);

    private DependencyResolver() {
    }

    /**
     * PENDING tasks whose every dependency is COMPLETED, in dispatch order.
     */
    public static List<Task> ready(TaskSnapshot snapshot) {
        return snapshot.tasks().stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .filter(t -> t.dependencies().stream().allMatch(dep -> isCompleted(snapshot, dep)))
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    /**
     * PENDING tasks that can never run because a task among their transitive dependencies
     * is FAILED, each mapped to the failed task that blocks it.
     */
    public static Map<String, String> blocked(TaskSnapshot snapshot) {
        Map<String, String> blocked = new LinkedHashMap<>();
        for (Task task : snapshot.tasks()) {
            if (task.status() != TaskStatus.FAILED) {
                continue;
            }
            for (String dependent : snapshot.transitiveDependents(task.id())) {
                snapshot.get(dependent)
                        .filter(t -> t.status() == TaskStatus.PENDING)
                        .ifPresent(t -> blocked.putIfAbsent(t.id(), task.id()));
            }
        }
        return blocked;
    }

    private static boolean isCompleted(TaskSnapshot snapshot, String id) {
        Optional<Task> dep = snapshot.get(id);
        return dep.isPresent() && dep.get().status() == TaskStatus.COMPLETED;
    }
}
