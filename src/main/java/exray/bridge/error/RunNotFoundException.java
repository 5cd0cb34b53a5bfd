package exray.bridge.error;

public class RunNotFoundException extends BridgeException {

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
