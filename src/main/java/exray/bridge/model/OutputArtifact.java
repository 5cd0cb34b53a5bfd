package exray.bridge.model;

/**
 * An output artifact recorded by the engine for a finished step.
 *
 * @param storage storage backend section the artifact declared ("s3", "gcs", "http", ...), or null
 */
public record OutputArtifact(String name, String storage, String bucket, String key) {

    public static final String OBJECT_STORE = "s3";

    public boolean isInObjectStore() {
        return OBJECT_STORE.equals(storage) && key != null && !key.isBlank();
    }
}
