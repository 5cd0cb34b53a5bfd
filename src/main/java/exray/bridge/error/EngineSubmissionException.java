package exray.bridge.error;

/**
 * The workflow engine rejected a submission, or could not be reached.
 * Nothing may be assumed to exist on the engine side afterwards.
 */
public class EngineSubmissionException extends BridgeException {

    /** Status code used when no HTTP response was received */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    private final String responseBody;

    public EngineSubmissionException(int statusCode, String responseBody) {
        super("Workflow submission failed with HTTP " + statusCode + ": " + abbreviate(responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public EngineSubmissionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
        this.responseBody = null;
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }

    static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 512 ? body.substring(0, 512) + "..." : body;
    }
}
