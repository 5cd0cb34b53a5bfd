package exray.bridge.api;

import exray.bridge.util.Jsons;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * One group of {@code /api/v1} routes. The router asks each registered controller in turn
 * whether it serves a request.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Runs on the blocking executor group, never on an I/O thread. Bridge failures are
     * left to propagate; the router turns them into status codes.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /** Status, content type and body; the router adds the remaining headers. */
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

        public static ControllerResponse text(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "text/plain", body);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    Jsons.toJson(Map.of("error", message != null ? message : status.reasonPhrase())));
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }
    }
}
