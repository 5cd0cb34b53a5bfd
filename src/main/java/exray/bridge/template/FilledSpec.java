package exray.bridge.template;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A workflow specification with parameters, buckets and resources filled in,
 * ready to hand to the engine.
 */
public final class FilledSpec {

    private final String templateName;
    private final ObjectNode workflow;

    FilledSpec(String templateName, ObjectNode workflow) {
        this.templateName = templateName;
        this.workflow = workflow;
    }

    public String templateName() {
        return templateName;
    }

    /** Engine-native workflow document. Returns a copy. */
    public ObjectNode workflow() {
        return workflow.deepCopy();
    }

    @Override
    public String toString() {
        return "FilledSpec{template='" + templateName + "'}";
    }
}
