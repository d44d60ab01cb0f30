package foreman.coordinator.api.v1;

import foreman.coordinator.api.Controller;
import foreman.coordinator.api.v1.dto.SubmitGoalRequest;
import foreman.coordinator.scheduler.Scheduler;
import foreman.coordinator.server.RouterHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Goal intake.
 * POST /api/v1/goals - Queue a goal for decomposition on the next scheduler pass
 */
public class GoalController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(GoalController.class);

    private final Scheduler scheduler;

    public GoalController(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/api/v1/goals".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        SubmitGoalRequest request = RouterHandler.mapper().readValue(body, SubmitGoalRequest.class);
        request.validate();

        scheduler.submitGoal(request.goal());
        log.debug("Accepted goal ({} chars)", request.goal().length());

        Map<String, Object> response = Map.of(
                "accepted", true,
                "pendingGoals", scheduler.pendingGoals());
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, RouterHandler.mapper().writeValueAsString(response));
    }
}
