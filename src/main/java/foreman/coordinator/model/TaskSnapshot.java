package foreman.coordinator.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, consistent view of the task store at one instant.
 * Tasks are kept in creation order.
 */
public final class TaskSnapshot {

    private final Map<String, Task> tasks;
    private final Map<String, List<String>> dependents;

    public TaskSnapshot(Collection<Task> tasks) {
        List<Task> ordered = new ArrayList<>(tasks);
        ordered.sort((a, b) -> Long.compare(a.sequence(), b.sequence()));

        Map<String, Task> byId = new LinkedHashMap<>();
        for (Task task : ordered) {
            byId.put(task.id(), task);
        }
        Map<String, List<String>> reverse = new HashMap<>();
        for (Task task : ordered) {
            for (String dep : task.dependencies()) {
                reverse.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }
        this.tasks = Collections.unmodifiableMap(byId);
        this.dependents = reverse;
    }

    public static TaskSnapshot empty() {
        return new TaskSnapshot(List.of());
    }

    /** All tasks in creation order */
    public Collection<Task> tasks() {
        return tasks.values();
    }

    public Optional<Task> get(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /** Tasks that list {@code id} as a direct dependency, in creation order */
    public List<String> directDependents(String id) {
        return List.copyOf(dependents.getOrDefault(id, List.of()));
    }

    /** Every task that depends on {@code id}, directly or transitively, breadth first */
    public Set<String> transitiveDependents(String id) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> frontier = new ArrayDeque<>(directDependents(id));
        while (!frontier.isEmpty()) {
            String next = frontier.poll();
            if (seen.add(next)) {
                frontier.addAll(directDependents(next));
            }
        }
        return seen;
    }

    public Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        for (Task task : tasks.values()) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return counts;
    }

    public int count(TaskStatus status) {
        return countByStatus().get(status);
    }

    /** Any task still pending, queued or in progress */
    public boolean hasActiveTasks() {
        return tasks.values().stream().anyMatch(t -> t.status().isActive());
    }
}
