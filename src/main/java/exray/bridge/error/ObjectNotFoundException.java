package exray.bridge.error;

public class ObjectNotFoundException extends BridgeException {

    private final String objectKey;

    public ObjectNotFoundException(String bucket, String objectKey) {
        super("Object " + objectKey + " not found in bucket " + bucket);
        this.objectKey = objectKey;
    }

    public String objectKey() {
        return objectKey;
    }
}
