package foreman.coordinator.api.v1;

import foreman.coordinator.api.Controller;
import foreman.coordinator.api.v1.dto.HealthResponse;
import foreman.coordinator.pool.WorkerPool;
import foreman.coordinator.repository.TaskRepository;
import foreman.coordinator.scheduler.Scheduler;
import foreman.coordinator.server.RouterHandler;
import foreman.coordinator.store.Database;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Scheduler scheduler;
    private final TaskRepository taskRepository;
    private final WorkerPool pool;
    private final Database database;

    /**
     * @param database null when tasks are kept in memory
     */
    public HealthController(Scheduler scheduler, TaskRepository taskRepository, WorkerPool pool, Database database) {
        this.scheduler = scheduler;
        this.taskRepository = taskRepository;
        this.pool = pool;
        this.database = database;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        String databaseStatus = "memory";
        if (database != null) {
            if (!database.isHealthy()) {
                log.warn("Health check: database connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }
            databaseStatus = "connected";
        }

        Map<String, Integer> tasks = new LinkedHashMap<>();
        taskRepository.snapshot().countByStatus()
                .forEach((status, count) -> tasks.put(status.name().toLowerCase(Locale.ROOT), count));

        HealthResponse response = HealthResponse.healthy(
                scheduler.state().name().toLowerCase(Locale.ROOT),
                scheduler.failureReason(),
                databaseStatus,
                formatUptime(),
                VERSION,
                tasks,
                pool.liveCount(),
                pool.queueDepth(),
                scheduler.pendingGoals());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
