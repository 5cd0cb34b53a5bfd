package exray.bridge.error;

/**
 * A read from the workflow engine failed (non-2xx other than 404, or transport error).
 */
public class EngineQueryException extends BridgeException {

    public static final int NO_RESPONSE = -1;

    private final String operation;
    private final String target;
    private final int statusCode;

    public EngineQueryException(String operation, String target, int statusCode, String responseBody) {
        super(operation + " for " + target + " failed with HTTP " + statusCode + ": "
                + EngineSubmissionException.abbreviate(responseBody));
        this.operation = operation;
        this.target = target;
        this.statusCode = statusCode;
    }

    public EngineQueryException(String operation, String target, Throwable cause) {
        super(operation + " for " + target + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
        this.target = target;
        this.statusCode = NO_RESPONSE;
    }

    public String operation() {
        return operation;
    }

    public String target() {
        return target;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_RESPONSE;
    }
}
