package foreman.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import foreman.coordinator.config.CoordinatorConfig;
import foreman.coordinator.config.Dependencies;
import foreman.coordinator.server.CoordinatorServer;
import foreman.coordinator.worker.Execution;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Workers run as in-process threads with an executor that always succeeds.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private Dependencies deps;
        private CoordinatorServer server;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() {
                CoordinatorConfig config = CoordinatorConfig.defaults()
                                .withMaxWorkers(3)
                                .withMinWorkers(1)
                                .withQueueTimeout(Duration.ofMillis(50))
                                .withSchedulerPollInterval(Duration.ofMillis(50))
                                .withHeartbeatInterval(Duration.ofMillis(50))
                                .withHealthCheckInterval(Duration.ofMillis(200))
                                // one scaling pass at start-up brings the pool to its floor
                                .withAutoScaleInterval(Duration.ofHours(1))
                                .withWorkerModels(List.of("model-a"));

                deps = Dependencies.create(config, (task, spec) -> Execution.completed("done " + task.id()));
                server = new CoordinatorServer(deps.routerHandler());
                int port = server.start("127.0.0.1", 0);
                deps.start();

                baseUrl = "http://127.0.0.1:" + port;
                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                server.stop();
                deps.close();
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
                return httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                                .header("Content-Type", "application/json")
                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> delete(String path) throws Exception {
                return httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).DELETE().build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        @Test
        @DisplayName("Health endpoint reports scheduler state and task counts")
        void healthEndpoint() throws Exception {
                HttpResponse<String> response = get("/api/v1/health");

                assertEquals(200, response.statusCode(), response.body());
                JsonNode json = MAPPER.readTree(response.body());
                assertEquals("healthy", json.get("status").asText());
                assertEquals("memory", json.get("database").asText());
                assertTrue(json.get("tasks").has("pending"));
        }

        @Test
        @DisplayName("Submitted plan runs to completion through worker threads")
        void goalRunsToCompletion() throws Exception {
                String plan = """
                                {"goal": "[{\\"id\\": \\"A\\", \\"title\\": \\"Schema\\"}, {\\"id\\": \\"B\\", \\"title\\": \\"API\\", \\"depends_on\\": [\\"A\\"]}]"}
                                """;

                HttpResponse<String> accepted = post("/api/v1/goals", plan);
                assertEquals(202, accepted.statusCode(), accepted.body());

                JsonNode completed = null;
                long deadline = System.currentTimeMillis() + 10_000;
                while (System.currentTimeMillis() < deadline) {
                        completed = MAPPER.readTree(get("/api/v1/tasks?status=completed").body());
                        if (completed.get("count").asInt() == 2) {
                                break;
                        }
                        Thread.sleep(50);
                }
                assertNotNull(completed);
                assertEquals(2, completed.get("count").asInt(), completed.toString());

                JsonNode b = MAPPER.readTree(get("/api/v1/tasks/B").body());
                assertEquals("completed", b.get("status").asText());
                assertEquals("done B", b.get("result").asText());
                assertEquals("A", b.get("depends_on").get(0).asText());
        }

        @Test
        @DisplayName("Workers can be spawned and stopped by hand")
        void workerLifecycle() throws Exception {
                HttpResponse<String> spawned = post("/api/v1/workers", "");
                assertEquals(201, spawned.statusCode(), spawned.body());
                String workerId = MAPPER.readTree(spawned.body()).get("workerId").asText();

                JsonNode pool = MAPPER.readTree(get("/api/v1/workers").body());
                assertEquals(3, pool.get("ceiling").asInt());
                assertTrue(pool.get("workers").size() >= 1);

                HttpResponse<String> stopped = delete("/api/v1/workers/" + workerId);
                assertEquals(200, stopped.statusCode(), stopped.body());
                assertEquals("stopped", MAPPER.readTree(stopped.body()).get("status").asText());

                assertEquals(404, delete("/api/v1/workers/" + workerId).statusCode());
        }

        @Test
        @DisplayName("Spawning past the ceiling returns 409")
        void spawnPastCeiling() throws Exception {
                int conflicts = 0;
                for (int i = 0; i < 10; i++) {
                        HttpResponse<String> response = post("/api/v1/workers", "");
                        if (response.statusCode() == 409) {
                                conflicts++;
                                assertTrue(response.body().contains("ceiling"), response.body());
                        }
                }
                assertTrue(conflicts >= 1, "expected refusals past the ceiling");
                assertTrue(deps.workerPool().liveCount() <= 3);
        }

        @Test
        @DisplayName("Bad input is rejected with 4xx")
        void badRequests() throws Exception {
                assertEquals(400, post("/api/v1/goals", "{\"goal\": \"\"}").statusCode());
                assertEquals(400, post("/api/v1/goals", "{not json").statusCode());
                assertEquals(400, get("/api/v1/tasks?status=sleeping").statusCode());
                assertEquals(404, get("/api/v1/tasks/nope").statusCode());
                assertEquals(404, get("/api/v1/nothing-here").statusCode());
        }
}
