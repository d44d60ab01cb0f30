package foreman.coordinator.scheduler;

import foreman.coordinator.model.Priority;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private static Task task(String id, long seq, TaskStatus status, String... deps) {
        return Task.builder().id(id).sequence(seq).status(status).dependsOn(deps).build();
    }

    @Test
    void chainReleasesOneTaskAtATime() {
        // C depends on A and B, B depends on A
        TaskSnapshot start = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.PENDING),
                task("B", 2, TaskStatus.PENDING, "A"),
                task("C", 3, TaskStatus.PENDING, "A", "B")));
        assertEquals(List.of("A"), ids(DependencyResolver.ready(start)));

        TaskSnapshot afterA = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.COMPLETED),
                task("B", 2, TaskStatus.PENDING, "A"),
                task("C", 3, TaskStatus.PENDING, "A", "B")));
        assertEquals(List.of("B"), ids(DependencyResolver.ready(afterA)));

        TaskSnapshot afterB = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.COMPLETED),
                task("B", 2, TaskStatus.COMPLETED, "A"),
                task("C", 3, TaskStatus.PENDING, "A", "B")));
        assertEquals(List.of("C"), ids(DependencyResolver.ready(afterB)));
    }

    @Test
    void joinWaitsForBothBranches() {
        TaskSnapshot start = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.PENDING),
                task("B", 2, TaskStatus.PENDING),
                task("C", 3, TaskStatus.PENDING, "A", "B")));
        assertEquals(List.of("A", "B"), ids(DependencyResolver.ready(start)));

        TaskSnapshot halfway = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.COMPLETED),
                task("B", 2, TaskStatus.QUEUED),
                task("C", 3, TaskStatus.PENDING, "A", "B")));
        assertEquals(List.of(), ids(DependencyResolver.ready(halfway)));

        TaskSnapshot both = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.COMPLETED),
                task("B", 2, TaskStatus.COMPLETED),
                task("C", 3, TaskStatus.PENDING, "A", "B")));
        assertEquals(List.of("C"), ids(DependencyResolver.ready(both)));
    }

    @Test
    void runningDependencyIsNotEnough() {
        TaskSnapshot snapshot = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.IN_PROGRESS),
                task("B", 2, TaskStatus.PENDING, "A")));

        assertTrue(DependencyResolver.ready(snapshot).isEmpty());
    }

    @Test
    void readyOrderedByPriorityThenCreation() {
        TaskSnapshot snapshot = new TaskSnapshot(List.of(
                Task.builder().id("low").sequence(1).priority(Priority.LOW).build(),
                Task.builder().id("med-2").sequence(3).build(),
                Task.builder().id("high").sequence(4).priority(Priority.HIGH).build(),
                Task.builder().id("med-1").sequence(2).build()));

        assertEquals(List.of("high", "med-1", "med-2", "low"), ids(DependencyResolver.ready(snapshot)));
    }

    @Test
    void blockedFollowsTransitiveDependents() {
        TaskSnapshot snapshot = new TaskSnapshot(List.of(
                task("A", 1, TaskStatus.FAILED),
                task("B", 2, TaskStatus.PENDING, "A"),
                task("C", 3, TaskStatus.PENDING, "B"),
                task("D", 4, TaskStatus.PENDING)));

        Map<String, String> blocked = DependencyResolver.blocked(snapshot);

        assertEquals(Map.of("B", "A", "C", "A"), blocked);
    }

    @Test
    void emptySnapshotHasNothingReady() {
        assertTrue(DependencyResolver.ready(TaskSnapshot.empty()).isEmpty());
        assertTrue(DependencyResolver.blocked(TaskSnapshot.empty()).isEmpty());
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }
}
