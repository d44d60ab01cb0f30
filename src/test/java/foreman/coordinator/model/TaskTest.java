package foreman.coordinator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void builderDefaults() {
        Task task = Task.builder().id("t1").build();

        assertEquals("t1", task.title());
        assertEquals("", task.instruction());
        assertEquals(Priority.MEDIUM, task.priority());
        assertEquals(TaskStatus.PENDING, task.status());
        assertEquals(3, task.maxAttempts());
        assertTrue(task.dependencies().isEmpty());
        assertTrue(task.canRetry());
    }

    @Test
    void toBuilderPreservesFields() {
        Task original = Task.builder()
                .id("t1")
                .title("Build API")
                .branch("feature/task-01-build-api")
                .targetPaths(List.of("api/main.py"))
                .dependsOn("t0")
                .attempts(2)
                .build();

        Task moved = original.toBuilder().status(TaskStatus.QUEUED).build();

        assertEquals(TaskStatus.QUEUED, moved.status());
        assertEquals(original.branch(), moved.branch());
        assertEquals(original.dependencies(), moved.dependencies());
        assertEquals(2, moved.attempts());
    }

    @Test
    void payloadCarriesWireFields() throws Exception {
        TaskPayload payload = Task.builder()
                .id("t1")
                .title("Build API")
                .priority(Priority.HIGH)
                .targetPaths(List.of("api/main.py"))
                .build()
                .toPayload();

        String json = new ObjectMapper().writeValueAsString(payload);

        assertTrue(json.contains("\"target_paths\":[\"api/main.py\"]"), json);
        assertTrue(json.contains("\"priority\":\"high\""), json);
    }

    @Test
    void retryStopsAtMaxAttempts() {
        assertFalse(Task.builder().id("t1").attempts(3).maxAttempts(3).build().canRetry());
        assertTrue(Task.builder().id("t1").status(TaskStatus.FAILED).build().isTerminal());
        assertFalse(Task.builder().id("t1").status(TaskStatus.IN_PROGRESS).build().isTerminal());
    }

    @Test
    void statusTransitionTable() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.QUEUED));
        assertTrue(TaskStatus.FAILED.canTransitionTo(TaskStatus.QUEUED));
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.IN_PROGRESS));
        assertFalse(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.QUEUED));
        assertFalse(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.QUEUED));
    }

    @Test
    void schedulerStateTable() {
        assertTrue(SchedulerState.IDLE.canTransitionTo(SchedulerState.DISPATCHING));
        assertTrue(SchedulerState.AWAITING_RESULTS.canTransitionTo(SchedulerState.DISPATCHING));
        assertFalse(SchedulerState.IDLE.canTransitionTo(SchedulerState.DONE));
        assertFalse(SchedulerState.DONE.canTransitionTo(SchedulerState.DISPATCHING));
        assertTrue(SchedulerState.FAILED.isTerminal());
    }

    @Test
    void priorityParsing() {
        assertEquals(Priority.HIGH, Priority.parse(" High "));
        assertEquals(Priority.MEDIUM, Priority.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Priority.parse("urgent"));
    }

    @Test
    void busyWorkerNeedsTask() {
        assertThrows(NullPointerException.class,
                () -> Worker.builder().id("worker-1").status(WorkerStatus.BUSY).build());
        Worker idle = Worker.builder().id("worker-1").status(WorkerStatus.IDLE).currentTaskId("t1").build();
        assertNull(idle.currentTaskId());
    }
}
