package foreman.coordinator.store;

import foreman.coordinator.exception.TaskNotFoundException;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;
import foreman.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * In-memory task store. Every method is synchronized on the repository,
 * which gives single-writer semantics and consistent snapshots.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRepository.class);

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Clock clock;
    private long nextSequence = 1;

    public InMemoryTaskRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryTaskRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void upsert(Task task) {
        upsertAll(List.of(task));
    }

    @Override
    public synchronized void upsertAll(List<Task> batch) {
        if (batch.isEmpty())
            return;

        TaskGraph.validate(edges(), batch);
        for (Task incoming : batch) {
            Task existing = tasks.get(incoming.id());
            if (existing != null) {
                TaskTransitions.checkReplaceable(existing, incoming);
            }
        }

        Instant now = clock.instant();
        for (Task incoming : batch) {
            Task existing = tasks.get(incoming.id());
            Task stored = existing == null
                    ? TaskTransitions.created(incoming, nextSequence++, now)
                    : TaskTransitions.merged(existing, incoming, now);
            tasks.put(stored.id(), stored);
        }
        log.debug("Upserted {} tasks", batch.size());
    }

    @Override
    public synchronized Optional<Task> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public synchronized List<Task> findByStatus(TaskStatus... statuses) {
        Set<TaskStatus> filter = statuses.length == 0
                ? EnumSet.allOf(TaskStatus.class)
                : EnumSet.copyOf(List.of(statuses));
        List<Task> result = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (filter.contains(task.status())) {
                result.add(task);
            }
        }
        return result;
    }

    @Override
    public synchronized Task transition(String taskId, TaskStatus next) {
        return update(taskId, t -> TaskTransitions.moved(t, next, clock.instant()));
    }

    @Override
    public synchronized Task markInProgress(String taskId, String workerId) {
        return update(taskId, t -> TaskTransitions.inProgress(t, workerId, clock.instant()));
    }

    @Override
    public synchronized Task markCompleted(String taskId, String detail) {
        return update(taskId, t -> TaskTransitions.completed(t, detail, clock.instant()));
    }

    @Override
    public synchronized Task markFailed(String taskId, String reason) {
        return update(taskId, t -> TaskTransitions.failed(t, reason, clock.instant()));
    }

    @Override
    public synchronized int countByStatus(TaskStatus status) {
        int count = 0;
        for (Task task : tasks.values()) {
            if (task.status() == status) {
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized TaskSnapshot snapshot() {
        return new TaskSnapshot(new ArrayList<>(tasks.values()));
    }

    private Task update(String taskId, UnaryOperator<Task> change) {
        Task current = tasks.get(taskId);
        if (current == null) {
            throw new TaskNotFoundException(taskId);
        }
        Task updated = change.apply(current);
        tasks.put(taskId, updated);
        log.debug("Task {}: {} -> {}", taskId, current.status(), updated.status());
        return updated;
    }

    private Map<String, Set<String>> edges() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (Task task : tasks.values()) {
            edges.put(task.id(), task.dependencies());
        }
        return edges;
    }
}
