package exray.bridge.error;

/**
 * The run never received a workflow name from the engine.
 */
public class NoEngineNameException extends BridgeException {

    public NoEngineNameException(String runId) {
        super("Workflow not recorded for run " + runId);
    }
}
