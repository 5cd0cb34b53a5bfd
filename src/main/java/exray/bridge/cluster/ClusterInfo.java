package exray.bridge.cluster;

import java.util.List;

/**
 * Resource summary of the Kubernetes cluster the engine runs on.
 * CPU is in cores, memory in GiB.
 */
public record ClusterInfo(
        int nodes,
        double totalCpu,
        double totalMemoryGb,
        double allocatableCpu,
        double allocatableMemoryGb,
        List<NodeDetail> nodeDetails) {

    public ClusterInfo {
        nodeDetails = nodeDetails != null ? List.copyOf(nodeDetails) : List.of();
    }

    public record NodeDetail(
            String name,
            boolean ready,
            double cpuCapacity,
            double cpuAllocatable,
            double memoryCapacityGb,
            double memoryAllocatableGb,
            String kubeletVersion) {
    }
}
