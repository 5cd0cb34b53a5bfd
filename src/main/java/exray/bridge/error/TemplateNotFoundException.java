package exray.bridge.error;

/**
 * No workflow template exists under the requested name.
 */
public class TemplateNotFoundException extends BridgeException {

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("Workflow template not found: " + templateName);
        this.templateName = templateName;
    }

    public TemplateNotFoundException(String templateName, Throwable cause) {
        super("Workflow template could not be loaded: " + templateName, cause);
        this.templateName = templateName;
    }

    public String templateName() {
        return templateName;
    }
}
