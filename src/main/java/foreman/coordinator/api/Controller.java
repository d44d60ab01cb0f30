package foreman.coordinator.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * One group of HTTP endpoints. The router asks each controller in turn whether it
 * matches, and hands the request to the first one that does.
 *
 * <p>Controllers let domain exceptions escape; the router maps them to status codes.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * @param path request path without the query string
     */
    ControllerResponse handle(FullHttpRequest req, String path) throws Exception;

    /**
     * Status, content type and body to write back.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse conflict(String message) {
            return error(HttpResponseStatus.CONFLICT, message);
        }

        static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
