package com.example.mediasync.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ObjectStore} on Amazon S3 or any S3-compatible endpoint.
 */
public final class S3ObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStore.class);
    private static final int PRECONDITION_FAILED = 412;

    private final S3Client s3Client;
    private final String bucket;
    private final String publicBaseUrl;

    public S3ObjectStore(StorageConfig config) {
        this(buildClient(config), config.bucket(), config.publicBaseUrl().orElse(null));
    }

    S3ObjectStore(S3Client s3Client, String bucket, String publicBaseUrl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl == null ? null : publicBaseUrl.replaceAll("/+$", "");
    }

    private static S3Client buildClient(StorageConfig config) {
        S3ClientBuilder builder = S3Client.builder();
        config.region().map(Region::of).ifPresent(builder::region);
        config.endpoint().map(URI::create).ifPresent(builder::endpointOverride);
        builder.serviceConfiguration(S3Configuration.builder()
                .pathStyleAccessEnabled(config.pathStyleAccess())
                .build());
        return builder.build();
    }

    @Override
    public PutStatus put(String path, Path file, String contentType, Duration timeout) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(path)
                .contentType(contentType)
                .ifNoneMatch("*")
                .overrideConfiguration(o -> o.apiCallTimeout(timeout))
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(file));
            LOGGER.info("Uploaded {} to s3://{}/{}", file, bucket, path);
            return PutStatus.CREATED;
        } catch (S3Exception ex) {
            if (ex.statusCode() == PRECONDITION_FAILED) {
                LOGGER.info("Object s3://{}/{} already exists", bucket, path);
                return PutStatus.EXISTS;
            }
            throw new ObjectStoreException("Upload to " + path + " failed: " + ex.getMessage(), ex);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException ex) {
            throw new ObjectStoreTimeoutException("Upload to " + path + " timed out after " + timeout.toSeconds() + "s", ex);
        } catch (SdkException ex) {
            throw new ObjectStoreException("Upload to " + path + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<StoredObject> list(String prefix) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .build();
        List<StoredObject> objects = new ArrayList<>();
        try {
            for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
                objects.add(new StoredObject(object.key(), object.size() == null ? 0L : object.size(), object.lastModified()));
            }
        } catch (SdkException ex) {
            throw new ObjectStoreException("Listing " + prefix + " failed: " + ex.getMessage(), ex);
        }
        return objects;
    }

    @Override
    public String publicUrl(String path) {
        if (publicBaseUrl != null) {
            return publicBaseUrl + "/" + path.replace(" ", "%20");
        }
        return s3Client.utilities()
                .getUrl(GetUrlRequest.builder().bucket(bucket).key(path).build())
                .toExternalForm();
    }

    @Override
    public void delete(String path) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(path).build());
            LOGGER.info("Deleted s3://{}/{}", bucket, path);
        } catch (SdkException ex) {
            throw new ObjectStoreException("Delete of " + path + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
