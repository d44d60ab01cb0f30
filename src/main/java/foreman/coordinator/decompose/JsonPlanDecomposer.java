package foreman.coordinator.decompose;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import foreman.coordinator.model.TaskDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads an explicit plan: a JSON array of task descriptions, or an object with a
 * {@code tasks} array. Descriptions may reference each other through {@code depends_on}.
 */
public final class JsonPlanDecomposer implements Decomposer {

    private final ObjectMapper mapper;

    public JsonPlanDecomposer() {
        this(new ObjectMapper());
    }

    public JsonPlanDecomposer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<TaskDescription> decompose(String goal) {
        JsonNode root;
        try {
            root = mapper.readTree(goal);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid plan JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode array = root != null && root.isObject() ? root.get("tasks") : root;
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("Plan must be a JSON array or an object with a 'tasks' array");
        }

        List<TaskDescription> tasks = new ArrayList<>();
        for (JsonNode node : array) {
            try {
                tasks.add(mapper.treeToValue(node, TaskDescription.class));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Invalid task in plan: " + e.getOriginalMessage(), e);
            }
        }
        if (tasks.isEmpty()) {
            throw new IllegalArgumentException("Plan contains no tasks");
        }
        return tasks;
    }

    /** Whether the goal text looks like a JSON plan rather than prose */
    public static boolean looksLikePlan(String goal) {
        if (goal == null) {
            return false;
        }
        String trimmed = goal.strip();
        return trimmed.startsWith("[") || trimmed.startsWith("{");
    }
}
