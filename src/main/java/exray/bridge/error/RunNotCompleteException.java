package exray.bridge.error;

public class RunNotCompleteException extends BridgeException {

    public RunNotCompleteException(String runId, String phase) {
        super("Run " + runId + " is not complete yet (phase: " + (phase != null ? phase : "unknown") + ")");
    }
}
