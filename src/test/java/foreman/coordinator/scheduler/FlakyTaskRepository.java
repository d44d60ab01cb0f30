package foreman.coordinator.scheduler;

import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;
import foreman.coordinator.repository.TaskRepository;

import java.util.List;
import java.util.Optional;

/**
 * Delegating store whose status writes start failing on demand.
 */
final class FlakyTaskRepository implements TaskRepository {

    private final TaskRepository delegate;
    private volatile RuntimeException failure;

    FlakyTaskRepository(TaskRepository delegate) {
        this.delegate = delegate;
    }

    void breakWrites() {
        breakWrites(new RuntimeException("store unavailable"));
    }

    void breakWrites(RuntimeException failure) {
        this.failure = failure;
    }

    private void check() {
        RuntimeException current = failure;
        if (current != null) {
            throw current;
        }
    }

    @Override
    public void upsert(Task task) {
        delegate.upsert(task);
    }

    @Override
    public void upsertAll(List<Task> tasks) {
        delegate.upsertAll(tasks);
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return delegate.findById(taskId);
    }

    @Override
    public List<Task> findByStatus(TaskStatus... statuses) {
        return delegate.findByStatus(statuses);
    }

    @Override
    public Task transition(String taskId, TaskStatus next) {
        check();
        return delegate.transition(taskId, next);
    }

    @Override
    public Task markInProgress(String taskId, String workerId) {
        check();
        return delegate.markInProgress(taskId, workerId);
    }

    @Override
    public Task markCompleted(String taskId, String detail) {
        check();
        return delegate.markCompleted(taskId, detail);
    }

    @Override
    public Task markFailed(String taskId, String reason) {
        check();
        return delegate.markFailed(taskId, reason);
    }

    @Override
    public int countByStatus(TaskStatus status) {
        return delegate.countByStatus(status);
    }

    @Override
    public TaskSnapshot snapshot() {
        return delegate.snapshot();
    }
}
