package exray.bridge.cluster;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.NodeStatus;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads node capacities through the Kubernetes API using a kubeconfig file.
 */
public class KubernetesClusterInfoProvider implements ClusterInfoProvider {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClusterInfoProvider.class);

    private final Path kubeconfig;

    public KubernetesClusterInfoProvider(Path kubeconfig) {
        this.kubeconfig = kubeconfig;
    }

    @Override
    public Optional<ClusterInfo> clusterInfo() {
        if (kubeconfig == null || !Files.isRegularFile(kubeconfig)) {
            log.debug("No kubeconfig at {}", kubeconfig);
            return Optional.empty();
        }
        try {
            Config config = Config.fromKubeconfig(Files.readString(kubeconfig, StandardCharsets.UTF_8));
            try (KubernetesClient client = new KubernetesClientBuilder().withConfig(config).build()) {
                return Optional.of(summarize(client.nodes().list().getItems()));
            }
        } catch (Exception e) {
            log.debug("Cluster info unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static ClusterInfo summarize(List<Node> nodes) {
        double totalCpu = 0.0;
        double totalMemory = 0.0;
        double allocatableCpu = 0.0;
        double allocatableMemory = 0.0;
        List<ClusterInfo.NodeDetail> details = new ArrayList<>();

        for (Node node : nodes) {
            NodeStatus status = node.getStatus();
            Map<String, Quantity> capacity = status != null ? status.getCapacity() : null;
            Map<String, Quantity> allocatable = status != null ? status.getAllocatable() : null;

            double cpuCap = ResourceQuantities.cpuCores(quantity(capacity, "cpu"));
            double cpuAlloc = ResourceQuantities.cpuCores(quantity(allocatable, "cpu"));
            double memCap = ResourceQuantities.memoryGb(quantity(capacity, "memory"));
            double memAlloc = ResourceQuantities.memoryGb(quantity(allocatable, "memory"));

            totalCpu += cpuCap;
            allocatableCpu += cpuAlloc;
            totalMemory += memCap;
            allocatableMemory += memAlloc;

            String name = node.getMetadata() != null && node.getMetadata().getName() != null
                    ? node.getMetadata().getName()
                    : "unknown";
            String kubelet = status != null && status.getNodeInfo() != null
                    ? status.getNodeInfo().getKubeletVersion()
                    : null;

            details.add(new ClusterInfo.NodeDetail(
                    name,
                    isReady(status),
                    ResourceQuantities.round(cpuCap, 2),
                    ResourceQuantities.round(cpuAlloc, 2),
                    ResourceQuantities.round(memCap, 2),
                    ResourceQuantities.round(memAlloc, 2),
                    kubelet));
        }

        return new ClusterInfo(
                nodes.size(),
                ResourceQuantities.round(totalCpu, 1),
                ResourceQuantities.round(totalMemory, 1),
                ResourceQuantities.round(allocatableCpu, 1),
                ResourceQuantities.round(allocatableMemory, 1),
                details);
    }

    private static boolean isReady(NodeStatus status) {
        if (status == null || status.getConditions() == null) {
            return false;
        }
        for (NodeCondition condition : status.getConditions()) {
            if ("Ready".equals(condition.getType())) {
                return "True".equals(condition.getStatus());
            }
        }
        return false;
    }

    private static String quantity(Map<String, Quantity> resources, String name) {
        if (resources == null) {
            return null;
        }
        Quantity q = resources.get(name);
        if (q == null || q.getAmount() == null) {
            return null;
        }
        return q.getFormat() != null ? q.getAmount() + q.getFormat() : q.getAmount();
    }
}
