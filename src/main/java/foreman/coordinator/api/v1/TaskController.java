package foreman.coordinator.api.v1;

import foreman.coordinator.api.Controller;
import foreman.coordinator.api.v1.dto.TaskResponse;
import foreman.coordinator.exception.TaskNotFoundException;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskStatus;
import foreman.coordinator.repository.TaskRepository;
import foreman.coordinator.server.RouterHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only task listing.
 *
 * GET /api/v1/tasks?status=pending,failed - List tasks, optionally filtered by status
 * GET /api/v1/tasks/{id} - One task
 */
public class TaskController implements Controller {

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final TaskRepository taskRepository;

    public TaskController(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String taskId = byId.group(1);
            Task task = taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
        }

        TaskStatus[] statuses = parseStatuses(new QueryStringDecoder(req.uri()).parameters());
        List<Task> tasks = statuses.length == 0
                ? List.copyOf(taskRepository.snapshot().tasks())
                : taskRepository.findByStatus(statuses);

        Map<String, Object> response = Map.of(
                "count", tasks.size(),
                "tasks", tasks.stream().map(TaskResponse::from).toList());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * Accepts repeated and comma-separated values: {@code ?status=pending&status=queued,failed}.
     *
     * @throws IllegalArgumentException on an unknown status name
     */
    static TaskStatus[] parseStatuses(Map<String, List<String>> params) {
        List<TaskStatus> statuses = new ArrayList<>();
        for (String value : params.getOrDefault("status", List.of())) {
            for (String name : value.split(",")) {
                if (name.isBlank()) {
                    continue;
                }
                try {
                    statuses.add(TaskStatus.valueOf(name.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown task status: " + name.trim(), e);
                }
            }
        }
        return statuses.toArray(new TaskStatus[0]);
    }
}
