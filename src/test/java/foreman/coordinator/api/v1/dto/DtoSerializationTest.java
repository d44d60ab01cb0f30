package foreman.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import foreman.coordinator.model.Priority;
import foreman.coordinator.model.ResourceUsage;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskStatus;
import foreman.coordinator.model.Worker;
import foreman.coordinator.model.WorkerStatus;
import foreman.coordinator.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DtoSerializationTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void taskResponseUsesWireNames() throws Exception {
        Task task = Task.builder()
                .id("task-1")
                .title("Build API")
                .status(TaskStatus.IN_PROGRESS)
                .priority(Priority.HIGH)
                .targetPaths(List.of("api/main.py"))
                .dependsOn("task-0")
                .assignedTo("worker-3")
                .createdAt(Instant.parse("2024-01-01T10:00:00Z"))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(TaskResponse.from(task)));

        assertEquals("in_progress", json.get("status").asText());
        assertEquals("high", json.get("priority").asText());
        assertEquals("api/main.py", json.get("target_paths").get(0).asText());
        assertEquals("task-0", json.get("depends_on").get(0).asText());
        assertEquals("2024-01-01T10:00:00Z", json.get("createdAt").asText());
        assertFalse(json.has("lastError"));
    }

    @Test
    void workerResponseFlattensUsage() throws Exception {
        Worker worker = Worker.builder()
                .id("worker-1")
                .model("model-a")
                .status(WorkerStatus.IDLE)
                .startedAt(Instant.parse("2024-01-01T10:00:00Z"))
                .usage(new ResourceUsage(1500, 0.003, 1200))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(WorkerResponse.from(worker)));

        assertEquals("idle", json.get("status").asText());
        assertEquals(1500, json.get("tokens").asLong());
        assertEquals(0.003, json.get("costUsd").asDouble(), 1e-9);
        assertFalse(json.has("currentTaskId"));
    }

    @Test
    void submitGoalRequestValidates() throws Exception {
        SubmitGoalRequest ok = mapper.readValue("{\"goal\": \"Build it\", \"extra\": true}", SubmitGoalRequest.class);
        ok.validate();
        assertEquals("Build it", ok.goal());

        SubmitGoalRequest blank = mapper.readValue("{\"goal\": \"\"}", SubmitGoalRequest.class);
        assertThrows(IllegalArgumentException.class, blank::validate);
        assertThrows(IllegalArgumentException.class, new SubmitGoalRequest(null)::validate);
    }

    @Test
    void unhealthyResponseOmitsStats() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(HealthResponse.unhealthy("connection failed")));

        assertEquals("unhealthy", json.get("status").asText());
        assertEquals("connection failed", json.get("database").asText());
        assertFalse(json.has("tasks"));
    }
}
