package exray.bridge.error;

public class WorkflowNotFoundException extends BridgeException {

    public WorkflowNotFoundException(String engineName) {
        super("Workflow " + engineName + " not found");
    }
}
