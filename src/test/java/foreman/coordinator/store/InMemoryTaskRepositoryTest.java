package foreman.coordinator.store;

import foreman.coordinator.exception.DependencyCycleException;
import foreman.coordinator.exception.InvalidTransitionException;
import foreman.coordinator.exception.TaskNotFoundException;
import foreman.coordinator.exception.UnknownDependencyException;
import foreman.coordinator.model.Priority;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskRepositoryTest {

    private InMemoryTaskRepository repo;

    @BeforeEach
    void setUp() {
        repo = new InMemoryTaskRepository();
    }

    @Test
    void upsertStoresNewTaskAsPending() {
        repo.upsert(Task.builder()
                .id("a")
                .title("Build API")
                .status(TaskStatus.COMPLETED)
                .attempts(2)
                .priority(Priority.HIGH)
                .build());

        Task stored = repo.findById("a").orElseThrow();
        assertEquals(TaskStatus.PENDING, stored.status());
        assertEquals(0, stored.attempts());
        assertEquals(Priority.HIGH, stored.priority());
        assertNotNull(stored.createdAt());
    }

    @Test
    void upsertExistingKeepsLifecycleFields() {
        repo.upsert(Task.builder().id("a").title("old").build());
        repo.transition("a", TaskStatus.QUEUED);
        repo.markInProgress("a", "worker-1");

        repo.upsert(Task.builder().id("a").title("new").build());

        Task stored = repo.findById("a").orElseThrow();
        assertEquals("new", stored.title());
        assertEquals(TaskStatus.IN_PROGRESS, stored.status());
        assertEquals("worker-1", stored.assignedTo());
    }

    @Test
    void batchMayReferenceItself() {
        repo.upsertAll(List.of(
                Task.builder().id("b").dependsOn("a").build(),
                Task.builder().id("a").build()));

        assertEquals(2, repo.snapshot().size());
        assertEquals(List.of("b"), repo.snapshot().directDependents("a"));
    }

    @Test
    void dependenciesOfQueuedTaskCannotChange() {
        repo.upsert(Task.builder().id("a").title("A").build());
        repo.transition("a", TaskStatus.QUEUED);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> repo.upsertAll(List.of(
                Task.builder().id("z").build(),
                Task.builder().id("y").dependsOn("z").build(),
                Task.builder().id("a").title("A again").dependsOn("y").build())));

        assertTrue(e.getMessage().contains("QUEUED"), e.getMessage());
        Task a = repo.findById("a").orElseThrow();
        assertTrue(a.dependencies().isEmpty());
        assertEquals("A", a.title());
        assertEquals(1, repo.snapshot().size());
    }

    @Test
    void queuedTaskMayBeReupsertedWithSameDependencies() {
        repo.upsertAll(List.of(
                Task.builder().id("a").build(),
                Task.builder().id("b").dependsOn("a").build()));
        repo.transition("a", TaskStatus.QUEUED);

        repo.upsert(Task.builder().id("a").title("renamed").build());

        assertEquals("renamed", repo.findById("a").orElseThrow().title());
        assertEquals(TaskStatus.QUEUED, repo.findById("a").orElseThrow().status());
    }

    @Test
    void pendingTaskMayGainDependencies() {
        repo.upsert(Task.builder().id("a").build());
        repo.upsertAll(List.of(
                Task.builder().id("y").build(),
                Task.builder().id("a").dependsOn("y").build()));

        assertEquals(Set.of("y"), repo.findById("a").orElseThrow().dependencies());
    }

    @Test
    void unknownDependencyRejectsWholeBatch() {
        UnknownDependencyException e = assertThrows(UnknownDependencyException.class, () -> repo.upsertAll(List.of(
                Task.builder().id("a").build(),
                Task.builder().id("b").dependsOn("missing").build())));

        assertTrue(e.getMessage().contains("missing"));
        assertTrue(repo.snapshot().isEmpty());
    }

    @Test
    void cycleIsRejectedAndStoreUnchanged() {
        repo.upsert(Task.builder().id("a").build());
        repo.upsert(Task.builder().id("b").dependsOn("a").build());

        assertThrows(DependencyCycleException.class,
                () -> repo.upsert(Task.builder().id("a").dependsOn("b").build()));

        assertTrue(repo.findById("a").orElseThrow().dependencies().isEmpty());
    }

    @Test
    void selfDependencyIsACycle() {
        assertThrows(DependencyCycleException.class,
                () -> repo.upsert(Task.builder().id("a").dependsOn("a").build()));
    }

    @Test
    void illegalTransitionIsRejected() {
        repo.upsert(Task.builder().id("a").build());

        assertThrows(InvalidTransitionException.class, () -> repo.transition("a", TaskStatus.COMPLETED));
        assertThrows(InvalidTransitionException.class, () -> repo.markInProgress("a", "worker-1"));
        assertEquals(TaskStatus.PENDING, repo.findById("a").orElseThrow().status());
    }

    @Test
    void completedIsFinal() {
        repo.upsert(Task.builder().id("a").build());
        repo.transition("a", TaskStatus.QUEUED);
        repo.markInProgress("a", "worker-1");
        repo.markCompleted("a", "done");

        Task done = repo.findById("a").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals("done", done.result());
        assertNull(done.assignedTo());
        assertThrows(InvalidTransitionException.class, () -> repo.markFailed("a", "late"));
    }

    @Test
    void failureCountsAttemptAndRetryStopsAtMax() {
        repo.upsert(Task.builder().id("a").maxAttempts(2).build());

        for (int i = 0; i < 2; i++) {
            repo.transition("a", TaskStatus.QUEUED);
            repo.markInProgress("a", "worker-1");
            repo.markFailed("a", "boom");
        }

        Task failed = repo.findById("a").orElseThrow();
        assertEquals(2, failed.attempts());
        assertFalse(failed.canRetry());
        assertThrows(InvalidTransitionException.class, () -> repo.transition("a", TaskStatus.QUEUED));
    }

    @Test
    void pendingFailureDoesNotCountAttempt() {
        repo.upsert(Task.builder().id("a").build());
        Task failed = repo.markFailed("a", "dependency failed: x");
        assertEquals(0, failed.attempts());
        assertEquals("dependency failed: x", failed.lastError());
    }

    @Test
    void unknownTaskThrows() {
        assertThrows(TaskNotFoundException.class, () -> repo.transition("nope", TaskStatus.QUEUED));
    }

    @Test
    void findByStatusKeepsCreationOrder() {
        repo.upsertAll(List.of(
                Task.builder().id("c").build(),
                Task.builder().id("a").build(),
                Task.builder().id("b").build()));
        repo.transition("a", TaskStatus.QUEUED);

        assertEquals(List.of("c", "b"),
                repo.findByStatus(TaskStatus.PENDING).stream().map(Task::id).toList());
        assertEquals(3, repo.findByStatus().size());
        assertEquals(1, repo.countByStatus(TaskStatus.QUEUED));
    }
}
