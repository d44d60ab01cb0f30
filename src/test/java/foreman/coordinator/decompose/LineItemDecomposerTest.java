package foreman.coordinator.decompose;

import foreman.coordinator.model.Priority;
import foreman.coordinator.model.TaskDescription;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineItemDecomposerTest {

    private final LineItemDecomposer decomposer = new LineItemDecomposer();

    @Test
    void oneTaskPerActionableLine() {
        String goal = """
                # Shop backend
                Overview
                - Create user authentication with password reset
                - Add REST endpoint for orders
                * Update README documentation
                ok
                """;

        List<TaskDescription> tasks = decomposer.decompose(goal);

        assertEquals(3, tasks.size());

        TaskDescription auth = tasks.get(0);
        assertEquals("Create User Authentication With Password Reset", auth.title());
        assertEquals("Create user authentication with password reset", auth.instruction());
        assertEquals("high", auth.priority());
        assertEquals("feature/task-01-create-user-authenti", auth.branch());
        assertEquals(List.of("auth/user.py", "auth/middleware.py", "auth/routes.py"), auth.targetPaths());
        assertNull(auth.id());
        assertTrue(auth.dependsOn().isEmpty());

        assertEquals("medium", tasks.get(1).priority());
        assertEquals(List.of("api/main.py", "api/routes.py"), tasks.get(1).targetPaths());
        assertTrue(tasks.get(1).branch().startsWith("feature/task-02-"));

        assertEquals("low", tasks.get(2).priority());
    }

    @Test
    void lineWithoutActionKeepsTextAsTitle() {
        List<TaskDescription> tasks = decomposer.decompose("The service should respond within 200 ms");

        assertEquals(1, tasks.size());
        assertEquals("The service should respond within 200 ms", tasks.get(0).title());
        assertEquals(List.of("src/main.py", "src/utils.py"), tasks.get(0).targetPaths());
    }

    @Test
    void longFallbackTitleIsTruncated() {
        String line = "The service should respond within two hundred milliseconds under heavy load";

        TaskDescription task = decomposer.decompose(line).get(0);

        assertEquals(line.substring(0, 50) + "...", task.title());
        assertEquals(line, task.instruction());
    }

    @Test
    void priorityKeywords() {
        assertEquals(Priority.HIGH, LineItemDecomposer.priorityOf("Secure the login flow"));
        assertEquals(Priority.HIGH, LineItemDecomposer.priorityOf("Migrate the database"));
        assertEquals(Priority.LOW, LineItemDecomposer.priorityOf("Tweak font sizes"));
        assertEquals(Priority.MEDIUM, LineItemDecomposer.priorityOf("Build the report generator"));
    }

    @Test
    void keywordsMatchAtWordStart() {
        // "build" contains "ui" but is not about the UI
        assertEquals(List.of("src/main.py", "src/utils.py"), LineItemDecomposer.targetsFor("build the pipeline"));
        assertEquals(List.of("Dockerfile", "docker-compose.yml", "deploy.sh"),
                LineItemDecomposer.targetsFor("deployment scripts for staging"));
        assertEquals(Priority.HIGH, LineItemDecomposer.priorityOf("Harden AUTHENTICATION tokens"));
        assertEquals(Priority.MEDIUM, LineItemDecomposer.priorityOf("Write the onboarding guide"));
    }

    @Test
    void emptyGoalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> decomposer.decompose(""));
        assertThrows(IllegalArgumentException.class, () -> decomposer.decompose("# only a header\nshort"));
    }
}
