package exray.bridge.error;

/**
 * Base class of the bridge's typed failures.
 */
public abstract class BridgeException extends RuntimeException {

    protected BridgeException(String message) {
        super(message);
    }

    protected BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
