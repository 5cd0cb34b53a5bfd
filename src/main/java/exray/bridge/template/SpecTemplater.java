package exray.bridge.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.model.ResourceLimits;

import java.util.Map;

/**
 * Fills a workflow template with run parameters, the artifact bucket and
 * resource limits. Pure transform over the loaded template.
 */
public class SpecTemplater {

    private final WorkflowTemplateCatalog catalog;
    private final String artifactBucket;

    public SpecTemplater(WorkflowTemplateCatalog catalog, String artifactBucket) {
        this.catalog = catalog;
        this.artifactBucket = artifactBucket;
    }

    /**
     * @param templateName name of the template (the workflow kind tag)
     * @param parameters   parameter values; names no step declares are ignored
     * @param limits       cpu/memory to apply to every container step, may be empty
     */
    public FilledSpec fill(String templateName, Map<String, String> parameters, ResourceLimits limits) {
        ObjectNode workflow = catalog.load(templateName);

        for (JsonNode step : workflow.path("spec").path("templates")) {
            if (!step.isObject()) {
                continue;
            }
            applyParameters(step, parameters);
            forceArtifactBucket(step);
            if (limits != null && !limits.isEmpty()) {
                applyLimits((ObjectNode) step, limits);
            }
        }
        return new FilledSpec(templateName, workflow);
    }

    private void applyParameters(JsonNode step, Map<String, String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return;
        }
        for (JsonNode param : step.path("inputs").path("parameters")) {
            if (!param.isObject()) {
                continue;
            }
            String name = param.path("name").asText(null);
            String value = name != null ? parameters.get(name) : null;
            if (value != null && !value.isEmpty()) {
                ((ObjectNode) param).put("value", value);
            }
        }
    }

    private void forceArtifactBucket(JsonNode step) {
        for (JsonNode artifact : step.path("outputs").path("artifacts")) {
            if (!artifact.isObject()) {
                continue;
            }
            ObjectNode objectArtifact = (ObjectNode) artifact;
            JsonNode s3 = objectArtifact.get("s3");
            ObjectNode s3Node = s3 != null && s3.isObject() ? (ObjectNode) s3 : objectArtifact.putObject("s3");
            s3Node.put("bucket", artifactBucket);
        }
    }

    private void applyLimits(ObjectNode step, ResourceLimits limits) {
        for (String section : new String[] { "container", "script" }) {
            JsonNode container = step.get(section);
            if (container == null || !container.isObject()) {
                continue;
            }
            ObjectNode resources = child((ObjectNode) container, "resources");
            ObjectNode limitsNode = child(resources, "limits");
            ObjectNode requestsNode = child(resources, "requests");
            if (limits.cpu() != null) {
                limitsNode.put("cpu", limits.cpu());
                requestsNode.put("cpu", limits.cpu());
            }
            if (limits.memory() != null) {
                limitsNode.put("memory", limits.memory());
                requestsNode.put("memory", limits.memory());
            }
        }
    }

    private static ObjectNode child(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        if (existing != null && existing.isObject()) {
            return (ObjectNode) existing;
        }
        return parent.putObject(name);
    }
}
