package exray.bridge.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import exray.bridge.cluster.ClusterInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("overall_status") String overallStatus,
        @JsonProperty("services") Map<String, ServiceStatus> services,
        @JsonProperty("cluster") ClusterResponse cluster) {

    public static final String CONNECTED = "connected";
    public static final String ERROR = "error";

    public record ServiceStatus(
            @JsonProperty("status") String status,
            @JsonProperty("message") String message) {

        public static ServiceStatus connected(String message) {
            return new ServiceStatus(CONNECTED, message);
        }

        public static ServiceStatus error(String message) {
            return new ServiceStatus(ERROR, message);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NodeResponse(
            @JsonProperty("name") String name,
            @JsonProperty("ready") boolean ready,
            @JsonProperty("cpu_capacity") double cpuCapacity,
            @JsonProperty("cpu_allocatable") double cpuAllocatable,
            @JsonProperty("memory_capacity_gb") double memoryCapacityGb,
            @JsonProperty("memory_allocatable_gb") double memoryAllocatableGb,
            @JsonProperty("kubelet_version") String kubeletVersion) {
    }

    public record ClusterResponse(
            @JsonProperty("nodes") int nodes,
            @JsonProperty("total_cpu") double totalCpu,
            @JsonProperty("total_memory_gb") double totalMemoryGb,
            @JsonProperty("allocatable_cpu") double allocatableCpu,
            @JsonProperty("allocatable_memory_gb") double allocatableMemoryGb,
            @JsonProperty("node_details") List<NodeResponse> nodeDetails) {

        public static ClusterResponse from(ClusterInfo info) {
            return new ClusterResponse(
                    info.nodes(),
                    info.totalCpu(),
                    info.totalMemoryGb(),
                    info.allocatableCpu(),
                    info.allocatableMemoryGb(),
                    info.nodeDetails().stream()
                            .map(n -> new NodeResponse(n.name(), n.ready(), n.cpuCapacity(), n.cpuAllocatable(),
                                    n.memoryCapacityGb(), n.memoryAllocatableGb(), n.kubeletVersion()))
                            .toList());
        }
    }

    /** Healthy only when every service reports connected; the cluster section never counts. */
    public static HealthResponse of(ServiceStatus engine, ServiceStatus objectStore, ClusterInfo cluster) {
        Map<String, ServiceStatus> services = new LinkedHashMap<>();
        services.put("argo", engine);
        services.put("minio", objectStore);
        boolean healthy = services.values().stream().allMatch(s -> CONNECTED.equals(s.status()));
        return new HealthResponse(
                healthy ? "healthy" : "unhealthy",
                services,
                cluster != null ? ClusterResponse.from(cluster) : null);
    }
}
