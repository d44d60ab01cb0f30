package foreman.coordinator.decompose;

import foreman.coordinator.model.Priority;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskDescription;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Converts decomposer output into task records ready for the store.
 * Dependency references are checked later, by the store, against the whole batch.
 */
public final class TaskDescriptions {

    private TaskDescriptions() {
    }

    /**
     * @param newId supplies ids for descriptions that carry none
     * @throws IllegalArgumentException for duplicate ids, unknown priorities or empty descriptions
     */
    public static List<Task> toTasks(List<TaskDescription> descriptions, int maxAttempts, Supplier<String> newId) {
        Set<String> seen = new HashSet<>();
        List<Task> tasks = new ArrayList<>(descriptions.size());
        for (TaskDescription d : descriptions) {
            String id = d.id() != null && !d.id().isBlank() ? d.id().strip() : newId.get();
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate task id in batch: " + id);
            }
            boolean hasTitle = d.title() != null && !d.title().isBlank();
            boolean hasInstruction = d.instruction() != null && !d.instruction().isBlank();
            if (!hasTitle && !hasInstruction) {
                throw new IllegalArgumentException("Task " + id + " has neither title nor instruction");
            }

            tasks.add(Task.builder()
                    .id(id)
                    .title(hasTitle ? d.title() : d.instruction())
                    .instruction(hasInstruction ? d.instruction() : d.title())
                    .branch(d.branch())
                    .targetPaths(d.targetPaths())
                    .priority(Priority.parse(d.priority()))
                    .dependencies(d.dependsOn())
                    .maxAttempts(maxAttempts)
                    .build());
        }
        return tasks;
    }
}
