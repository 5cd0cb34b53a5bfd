package exray.bridge.error;

/**
 * Object-store transport or protocol failure.
 */
public class ArtifactStoreException extends BridgeException {

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
