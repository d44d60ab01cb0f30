package foreman.coordinator.api.v1;

import foreman.coordinator.api.Controller;
import foreman.coordinator.api.v1.dto.PoolStatusResponse;
import foreman.coordinator.api.v1.dto.WorkerResponse;
import foreman.coordinator.model.Worker;
import foreman.coordinator.pool.WorkerPool;
import foreman.coordinator.server.RouterHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Manual control of the worker pool.
 *
 * GET /api/v1/workers - Pool status snapshot
 * POST /api/v1/workers - Spawn one worker
 * DELETE /api/v1/workers/{id} - Stop a worker
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private static final Pattern WORKERS_PATTERN = Pattern.compile("^/api/v1/workers$");
    private static final Pattern WORKER_BY_ID_PATTERN = Pattern.compile("^/api/v1/workers/([^/]+)$");

    private final WorkerPool pool;

    public WorkerController(WorkerPool pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (WORKERS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        return method.equals(HttpMethod.DELETE) && WORKER_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.GET)) {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    PoolStatusResponse.from(pool.snapshot())));
        }

        if (req.method().equals(HttpMethod.POST)) {
            Worker worker = pool.spawn();
            log.debug("Spawned {} on request", worker.id());
            return ControllerResponse.json(HttpResponseStatus.CREATED,
                    RouterHandler.mapper().writeValueAsString(WorkerResponse.from(worker)));
        }

        Matcher matcher = WORKER_BY_ID_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown worker endpoint");
        }
        Worker stopped = pool.stop(matcher.group(1));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(WorkerResponse.from(stopped)));
    }
}
