package exray.bridge.artifact;

import exray.bridge.config.BridgeConfig;
import exray.bridge.error.ArtifactStoreException;
import exray.bridge.error.ObjectNotFoundException;
import io.minio.BucketExistsArgs;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.StatObjectArgs;
import io.minio.UploadObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import io.minio.http.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ArtifactStore} backed by a MinIO (S3-compatible) bucket.
 */
public class MinioArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(MinioArtifactStore.class);

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchObject", "NoSuchBucket");

    private final MinioClient client;
    private final String bucket;

    public MinioArtifactStore(BridgeConfig config) {
        this(MinioClient.builder()
                .endpoint(config.artifactEndpoint())
                .credentials(config.artifactAccessKey(), config.artifactSecretKey())
                .build(), config.artifactBucket());
    }

    public MinioArtifactStore(MinioClient client, String bucket) {
        this.client = client;
        this.bucket = bucket;
    }

    @Override
    public String bucket() {
        return bucket;
    }

    @Override
    public void upload(String key, Path localFile) {
        try {
            if (!client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                log.info("Creating bucket {}", bucket);
                client.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
            client.uploadObject(UploadObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .filename(localFile.toString())
                    .build());
            log.debug("Uploaded {} to {}/{}", localFile.getFileName(), bucket, key);
        } catch (MinioException | IOException | GeneralSecurityException e) {
            throw new ArtifactStoreException("Upload of " + key + " to bucket " + bucket + " failed", e);
        }
    }

    @Override
    public URL presignedGetUrl(String key, Duration ttl) {
        try {
            client.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            String url = client.getPresignedObjectUrl(GetPresignedObjectUrlArgs.builder()
                    .method(Method.GET)
                    .bucket(bucket)
                    .object(key)
                    .expiry((int) ttl.toSeconds(), TimeUnit.SECONDS)
                    .build());
            return new URL(url);
        } catch (ErrorResponseException e) {
            if (NOT_FOUND_CODES.contains(e.errorResponse().code())) {
                throw new ObjectNotFoundException(bucket, key);
            }
            throw new ArtifactStoreException("Presigning " + key + " failed", e);
        } catch (MalformedURLException e) {
            throw new ArtifactStoreException("Object store returned a malformed URL for " + key, e);
        } catch (MinioException | IOException | GeneralSecurityException e) {
            throw new ArtifactStoreException("Presigning " + key + " failed", e);
        }
    }

    @Override
    public boolean bucketExists() {
        try {
            return client.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
        } catch (MinioException | IOException | GeneralSecurityException e) {
            throw new ArtifactStoreException("Bucket probe for " + bucket + " failed", e);
        }
    }
}
