package exray.bridge.server;

import exray.bridge.api.Controller;
import exray.bridge.api.Controller.ControllerResponse;
import exray.bridge.error.ArtifactStoreException;
import exray.bridge.error.DuplicateRunException;
import exray.bridge.error.EngineQueryException;
import exray.bridge.error.EngineSubmissionException;
import exray.bridge.error.NoEngineNameException;
import exray.bridge.error.ObjectNotFoundException;
import exray.bridge.error.ResultUnavailableException;
import exray.bridge.error.RunNotCompleteException;
import exray.bridge.error.RunNotFoundException;
import exray.bridge.error.TemplateNotFoundException;
import exray.bridge.error.WorkflowNotFoundException;
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
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_GATEWAY;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.CONFLICT;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers
 * and maps bridge failures to HTTP status codes.
 *
 * Only /api/v1/* endpoints are served; everything else returns 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

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

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        ControllerResponse response = dispatch(ctx, req, method, path);
        log.debug("{} {} -> {}", method, path, response.status().code());
        writeSafe(ctx, response, keepAlive);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");
        } catch (Exception e) {
            return toErrorResponse(method, path, e);
        }
    }

    /**
     * Failure to status code: 400 for caller mistakes, 404 for anything missing, 409 for runs
     * still executing, 502 for upstream failures.
     */
    static ControllerResponse toErrorResponse(HttpMethod method, String path, Exception e) {
        HttpResponseStatus status;
        if (e instanceof IllegalArgumentException || e instanceof TemplateNotFoundException) {
            status = BAD_REQUEST;
        } else if (e instanceof RunNotFoundException || e instanceof ResultUnavailableException
                || e instanceof NoEngineNameException || e instanceof WorkflowNotFoundException
                || e instanceof ObjectNotFoundException) {
            status = NOT_FOUND;
        } else if (e instanceof RunNotCompleteException || e instanceof DuplicateRunException) {
            status = CONFLICT;
        } else if (e instanceof EngineSubmissionException || e instanceof EngineQueryException
                || e instanceof ArtifactStoreException) {
            status = BAD_GATEWAY;
        } else {
            status = INTERNAL_SERVER_ERROR;
        }

        if (status == INTERNAL_SERVER_ERROR) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.error(status, "internal error: " + e.getMessage());
        }
        if (status == BAD_GATEWAY) {
            log.warn("Upstream failure on {} {}: {}", method, path, e.getMessage());
        } else {
            log.debug("{} {} rejected with {}: {}", method, path, status.code(), e.getMessage());
        }
        return ControllerResponse.error(status, e.getMessage());
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        try {
            String body = response.body() != null ? response.body() : "";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse httpResponse = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            httpResponse.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            HttpUtil.setKeepAlive(httpResponse, keepAlive);
            ctx.writeAndFlush(httpResponse);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, ControllerResponse.error(INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage()),
                    false);
        } finally {
            ctx.close();
        }
    }
}
