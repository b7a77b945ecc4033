package com.resona.storage;

import com.resona.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Amazon S3 object storage.
 * Object key pattern: {prefix}{cacheKey}
 */
@Slf4j
public class S3ObjectStorageProvider implements ObjectStorageProvider {

    static final String DEPENDENCY = "s3-cache";
    private static final String CONTENT_TYPE = "application/octet-stream";

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;
    private final Duration ttl;

    public S3ObjectStorageProvider(S3Client s3Client, String bucket, String prefix, Duration ttl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = prefix != null ? prefix : "";
        this.ttl = ttl;
    }

    @Override
    public String getName() {
        return "s3";
    }

    @Override
    public Optional<StoredObject> get(String key) {
        String objectKey = objectKey(key);
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(objectKey)
                    .build());
            log.debug("S3 cache hit: {}", objectKey);
            return Optional.of(new StoredObject(bytes.asByteArray(), bytes.response().lastModified()));
        } catch (NoSuchKeyException e) {
            log.debug("S3 cache miss: {}", objectKey);
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw transientError("get", objectKey, e);
        } catch (SdkException e) {
            throw transientError("get", objectKey, e);
        }
    }

    @Override
    public void put(String key, byte[] payload, Map<String, String> metadata) {
        String objectKey = objectKey(key);
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(objectKey)
                            .contentType(CONTENT_TYPE)
                            .cacheControl("max-age=" + ttl.toSeconds())
                            .metadata(metadata)
                            .build(),
                    RequestBody.fromBytes(payload));
            log.debug("Stored in S3 cache: key={}, size={}KB", objectKey, payload.length / 1024);
        } catch (SdkException e) {
            throw transientError("put", objectKey, e);
        }
    }

    @Override
    public Optional<Instant> headMetadata(String key) {
        String objectKey = objectKey(key);
        try {
            HeadObjectResponse head = s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(objectKey)
                    .build());
            return Optional.ofNullable(head.lastModified());
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw transientError("head", objectKey, e);
        } catch (SdkException e) {
            throw transientError("head", objectKey, e);
        }
    }

    @Override
    public void delete(String key) {
        String objectKey = objectKey(key);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(objectKey)
                    .build());
            log.debug("Deleted from S3 cache: {}", objectKey);
        } catch (SdkException e) {
            throw transientError("delete", objectKey, e);
        }
    }

    @Override
    public void ping() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (SdkException e) {
            throw new TransientDependencyException(DEPENDENCY, "bucket " + bucket + " unreachable: "
                    + e.getMessage(), e);
        }
    }

    String objectKey(String key) {
        return prefix + key;
    }

    private TransientDependencyException transientError(String operation, String objectKey, SdkException e) {
        return new TransientDependencyException(DEPENDENCY,
                operation + " " + bucket + "/" + objectKey + " failed: " + e.getMessage(), e);
    }
}
