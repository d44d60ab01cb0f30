package foreman.coordinator.store;

import foreman.coordinator.config.CoordinatorConfig;
import foreman.coordinator.exception.DependencyCycleException;
import foreman.coordinator.exception.InvalidTransitionException;
import foreman.coordinator.model.Priority;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static Database db;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-tasks;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM task_dependencies");
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
    }

    @Test
    void upsertAndFindById() {
        repo.upsert(Task.builder()
                .id("task-1")
                .title("Create login page")
                .instruction("Create login page")
                .branch("feature/task-01-create-login")
                .targetPaths(List.of("auth/user.py", "auth/routes.py"))
                .priority(Priority.HIGH)
                .maxAttempts(5)
                .build());

        Task found = repo.findById("task-1").orElseThrow();
        assertEquals("Create login page", found.title());
        assertEquals("feature/task-01-create-login", found.branch());
        assertEquals(List.of("auth/user.py", "auth/routes.py"), found.targetPaths());
        assertEquals(Priority.HIGH, found.priority());
        assertEquals(TaskStatus.PENDING, found.status());
        assertEquals(5, found.maxAttempts());
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void dependenciesSurviveRoundTrip() {
        repo.upsertAll(List.of(
                Task.builder().id("a").build(),
                Task.builder().id("b").build(),
                Task.builder().id("c").dependsOn("a", "b").build()));

        TaskSnapshot snapshot = repo.snapshot();
        assertEquals(Set.of("a", "b"), snapshot.get("c").orElseThrow().dependencies());
        assertEquals(List.of("c"), snapshot.directDependents("a"));
        assertEquals(List.of("a", "b", "c"), snapshot.tasks().stream().map(Task::id).toList());
    }

    @Test
    void cycleRollsBackWholeBatch() {
        repo.upsert(Task.builder().id("a").build());

        assertThrows(DependencyCycleException.class, () -> repo.upsertAll(List.of(
                Task.builder().id("b").dependsOn("c").build(),
                Task.builder().id("c").dependsOn("b").build())));

        assertEquals(1, repo.snapshot().size());
    }

    @Test
    void dependencyChangeOnStartedTaskRollsBack() {
        repo.upsert(Task.builder().id("a").title("A").build());
        repo.transition("a", TaskStatus.QUEUED);
        repo.markInProgress("a", "worker-1");

        assertThrows(IllegalArgumentException.class, () -> repo.upsertAll(List.of(
                Task.builder().id("y").build(),
                Task.builder().id("a").title("A again").dependsOn("y").build())));

        Task a = repo.findById("a").orElseThrow();
        assertTrue(a.dependencies().isEmpty());
        assertEquals("A", a.title());
        assertEquals(TaskStatus.IN_PROGRESS, a.status());
        assertTrue(repo.findById("y").isEmpty());
    }

    @Test
    void lifecycleIsPersisted() {
        repo.upsert(Task.builder().id("a").maxAttempts(2).build());

        repo.transition("a", TaskStatus.QUEUED);
        Task running = repo.markInProgress("a", "worker-1");
        assertEquals("worker-1", running.assignedTo());

        repo.markFailed("a", "boom");
        Task failed = repo.findById("a").orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(1, failed.attempts());
        assertEquals("boom", failed.lastError());
        assertNull(failed.assignedTo());

        repo.transition("a", TaskStatus.QUEUED);
        repo.markInProgress("a", "worker-2");
        repo.markCompleted("a", "{\"ok\":true}");

        Task done = repo.findById("a").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals("{\"ok\":true}", done.result());
        assertEquals(1, repo.countByStatus(TaskStatus.COMPLETED));
    }

    @Test
    void rejectedTransitionLeavesRowUntouched() {
        repo.upsert(Task.builder().id("a").build());

        assertThrows(InvalidTransitionException.class, () -> repo.markCompleted("a", "x"));

        assertEquals(TaskStatus.PENDING, repo.findById("a").orElseThrow().status());
    }

    @Test
    void findByStatusFilters() {
        repo.upsertAll(List.of(
                Task.builder().id("a").build(),
                Task.builder().id("b").build()));
        repo.transition("b", TaskStatus.QUEUED);

        assertEquals(List.of("b"), repo.findByStatus(TaskStatus.QUEUED).stream().map(Task::id).toList());
        assertEquals(2, repo.findByStatus(TaskStatus.PENDING, TaskStatus.QUEUED).size());
    }

    @Test
    void databaseIsHealthy() {
        assertTrue(db.isHealthy());
    }
}
