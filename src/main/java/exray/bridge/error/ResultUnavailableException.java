package exray.bridge.error;

/**
 * The run finished but no downloadable result could be located.
 */
public class ResultUnavailableException extends BridgeException {

    public ResultUnavailableException(String runId, String reason) {
        super("Result not available for run " + runId + ": " + reason);
    }

    public ResultUnavailableException(String runId, String reason, Throwable cause) {
        super("Result not available for run " + runId + ": " + reason, cause);
    }
}
