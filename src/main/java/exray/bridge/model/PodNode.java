package exray.bridge.model;

/**
 * An execution-graph node that ran in a pod.
 *
 * @param startedAt raw engine timestamp, null when the node has not started
 */
public record PodNode(String displayName, String podName, String phase, String startedAt) {
}
