package foreman.coordinator.store;

import foreman.coordinator.exception.DependencyCycleException;
import foreman.coordinator.exception.UnknownDependencyException;
import foreman.coordinator.model.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency graph validation shared by the task store implementations.
 */
final class TaskGraph {

    private enum Mark {
        VISITING, DONE
    }

    private TaskGraph() {
    }

    /**
     * Validate the graph obtained by applying {@code incoming} on top of {@code existing}.
     *
     * @param existing dependency edges already stored, task id -> dependency ids
     * @param incoming tasks being inserted or replaced
     * @throws UnknownDependencyException if a dependency id is neither stored nor incoming
     * @throws DependencyCycleException   if the merged graph contains a cycle
     */
    static void validate(Map<String, Set<String>> existing, Collection<Task> incoming) {
        Map<String, Set<String>> merged = new LinkedHashMap<>(existing);
        for (Task task : incoming) {
            merged.put(task.id(), task.dependencies());
        }

        for (Task task : incoming) {
            for (String dep : task.dependencies()) {
                if (!merged.containsKey(dep)) {
                    throw new UnknownDependencyException(task.id(), dep);
                }
            }
        }

        // Only paths through incoming tasks can be new, so start the search there.
        Map<String, Mark> marks = new HashMap<>();
        for (Task task : incoming) {
            List<String> cycle = findCycle(task.id(), merged, marks, new ArrayList<>());
            if (cycle != null) {
                throw new DependencyCycleException(cycle);
            }
        }
    }

    private static List<String> findCycle(String id, Map<String, Set<String>> graph,
            Map<String, Mark> marks, List<String> path) {
        Mark mark = marks.get(id);
        if (mark == Mark.DONE) {
            return null;
        }
        if (mark == Mark.VISITING) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
            cycle.add(id);
            return cycle;
        }

        marks.put(id, Mark.VISITING);
        path.add(id);
        for (String dep : graph.getOrDefault(id, Set.of())) {
            List<String> cycle = findCycle(dep, graph, marks, path);
            if (cycle != null) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        marks.put(id, Mark.DONE);
        return null;
    }
}
