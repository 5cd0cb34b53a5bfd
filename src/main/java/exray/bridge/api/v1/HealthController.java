package exray.bridge.api.v1;

import exray.bridge.api.Controller;
import exray.bridge.api.v1.dto.HealthResponse;
import exray.bridge.api.v1.dto.HealthResponse.ServiceStatus;
import exray.bridge.artifact.ArtifactStore;
import exray.bridge.cluster.ClusterInfoProvider;
import exray.bridge.engine.WorkflowEngineClient;
import exray.bridge.util.Jsons;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final WorkflowEngineClient engine;
    private final ArtifactStore artifacts;
    private final ClusterInfoProvider cluster;

    public HealthController(WorkflowEngineClient engine, ArtifactStore artifacts, ClusterInfoProvider cluster) {
        this.engine = engine;
        this.artifacts = artifacts;
        this.cluster = cluster;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        ServiceStatus engineStatus = engine.ping()
                ? ServiceStatus.connected("Argo Workflows server accessible")
                : ServiceStatus.error("Argo Workflows server unreachable");

        ServiceStatus storeStatus;
        try {
            boolean exists = artifacts.bucketExists();
            storeStatus = ServiceStatus.connected("MinIO accessible, bucket '" + artifacts.bucket() + "' "
                    + (exists ? "exists" : "missing"));
        } catch (RuntimeException e) {
            log.warn("Object store health probe failed: {}", e.getMessage());
            storeStatus = ServiceStatus.error("MinIO connection failed: " + e.getMessage());
        }

        HealthResponse response = HealthResponse.of(engineStatus, storeStatus, cluster.clusterInfo().orElse(null));
        return ControllerResponse.json(Jsons.toJson(response));
    }
}
