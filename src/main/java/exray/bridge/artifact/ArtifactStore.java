package exray.bridge.artifact;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Object storage shared with the workflow engine.
 * Inputs are uploaded under {@code input/} and {@code python/}; workflows write under {@code output/}.
 */
public interface ArtifactStore {

    /**
     * Bucket every key of this store lives in.
     */
    String bucket();

    /**
     * Uploads a local file under the given key, creating the bucket when missing.
     *
     * @throws exray.bridge.error.ArtifactStoreException if the upload fails
     */
    void upload(String key, Path localFile);

    /**
     * Returns a time-limited download link for an existing object.
     *
     * @throws exray.bridge.error.ObjectNotFoundException if no object exists under the key
     * @throws exray.bridge.error.ArtifactStoreException on transport or protocol failure
     */
    URL presignedGetUrl(String key, Duration ttl);

    /**
     * Reachability probe for health reporting.
     *
     * @throws exray.bridge.error.ArtifactStoreException if the store cannot be reached
     */
    boolean bucketExists();
}
