package foreman.coordinator.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import foreman.coordinator.api.Controller;
import foreman.coordinator.api.Controller.ControllerResponse;
import foreman.coordinator.exception.ScaleLimitExceededException;
import foreman.coordinator.exception.TaskNotFoundException;
import foreman.coordinator.exception.WorkerNotFoundException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Domain exceptions escaping a controller become status codes:
 * - IllegalArgumentException, malformed JSON: 400
 * - WorkerNotFoundException, TaskNotFoundException: 404
 * - ScaleLimitExceededException: 409
 * - anything else: 500
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        writeSafe(ctx, route(req, method, path));
    }

    ControllerResponse route(FullHttpRequest req, HttpMethod method, String path) {
        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(req, path);
                }
            }
            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON on {} {}: {}", method, path, e.getOriginalMessage());
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (WorkerNotFoundException | TaskNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (ScaleLimitExceededException e) {
            log.info("Spawn refused: {}", e.getMessage());
            return ControllerResponse.conflict(e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.error(INTERNAL_SERVER_ERROR, e.toString());
        }
    }

    /**
     * Write a response, falling back to a bare 500 and finally to closing the channel.
     */
    private void writeSafe(ChannelHandlerContext ctx, ControllerResponse response) {
        try {
            write(ctx, response.status(), response.contentType(), response.body());
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            try {
                write(ctx, INTERNAL_SERVER_ERROR, "application/json", "{\"error\":\"failed to write response\"}");
            } catch (RuntimeException e2) {
                log.error("Complete failure writing error response", e2);
                ctx.close();
            }
        }
    }

    private static void write(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, INTERNAL_SERVER_ERROR, "application/json", "{\"error\":\"channel error\"}");
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
