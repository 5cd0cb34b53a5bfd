package exray.bridge.cluster;

import java.util.Optional;

public interface ClusterInfoProvider {

    /**
     * @return cluster summary, or empty when the cluster cannot be reached
     */
    Optional<ClusterInfo> clusterInfo();
}
