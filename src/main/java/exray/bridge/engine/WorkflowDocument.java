package exray.bridge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import exray.bridge.model.OutputArtifact;
import exray.bridge.model.PodNode;
import exray.bridge.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Narrow adapter over the engine's native workflow document.
 * Nothing outside this package sees the raw JSON.
 */
public final class WorkflowDocument {

    private static final String[] ARTIFACT_BACKENDS = { "s3", "gcs", "azure", "oss", "hdfs", "http", "git", "raw" };

    private final JsonNode root;

    private WorkflowDocument(JsonNode root) {
        this.root = root != null ? root : MissingNode.getInstance();
    }

    public static WorkflowDocument of(JsonNode root) {
        return new WorkflowDocument(root);
    }

    public String name() {
        return Jsons.text(root.path("metadata"), "name");
    }

    public String namespace() {
        return Jsons.text(root.path("metadata"), "namespace");
    }

    /** Scalar field of the status section, or null. */
    String statusField(String field) {
        JsonNode status = root.path("status");
        return status.isObject() ? Jsons.text(status, field) : null;
    }

    /**
     * Execution nodes that ran in a pod, in document order.
     */
    List<PodNode> podNodes() {
        List<PodNode> nodes = new ArrayList<>();
        JsonNode all = root.path("status").path("nodes");
        if (!all.isObject()) {
            return nodes;
        }
        Iterator<JsonNode> it = all.elements();
        while (it.hasNext()) {
            JsonNode node = it.next();
            String podName = Jsons.text(node, "podName");
            if (podName == null || podName.isBlank()) {
                continue;
            }
            String displayName = firstNonBlank(Jsons.text(node, "displayName"), Jsons.text(node, "name"), podName);
            String phase = firstNonBlank(Jsons.text(node, "phase"), "Unknown");
            String startedAt = Jsons.text(node, "startedAt");
            nodes.add(new PodNode(displayName, podName, phase, startedAt == null || startedAt.isBlank() ? null : startedAt));
        }
        return nodes;
    }

    /**
     * Output artifacts recorded for the workflow: the workflow-level outputs first,
     * then those of individual nodes in document order.
     */
    public List<OutputArtifact> outputArtifacts() {
        List<OutputArtifact> artifacts = new ArrayList<>();
        collectArtifacts(root.path("status").path("outputs").path("artifacts"), artifacts);
        JsonNode nodes = root.path("status").path("nodes");
        if (nodes.isObject()) {
            for (JsonNode node : nodes) {
                collectArtifacts(node.path("outputs").path("artifacts"), artifacts);
            }
        }
        return artifacts;
    }

    private static void collectArtifacts(JsonNode list, List<OutputArtifact> into) {
        if (!list.isArray()) {
            return;
        }
        for (JsonNode artifact : list) {
            String storage = null;
            JsonNode location = MissingNode.getInstance();
            for (String backend : ARTIFACT_BACKENDS) {
                if (artifact.path(backend).isObject()) {
                    storage = backend;
                    location = artifact.path(backend);
                    break;
                }
            }
            into.add(new OutputArtifact(
                    Jsons.text(artifact, "name"),
                    storage,
                    Jsons.text(location, "bucket"),
                    Jsons.text(location, "key")));
        }
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "WorkflowDocument{name=" + name() + "}";
    }
}
