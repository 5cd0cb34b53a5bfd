package exray.bridge.error;

public class DuplicateRunException extends BridgeException {

    private final String runId;

    public DuplicateRunException(String runId) {
        super("Run " + runId + " already exists");
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
