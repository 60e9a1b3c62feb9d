package com.sitesmith.storage;

import com.sitesmith.core.error.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ObjectStore} backed by an S3-compatible bucket (AWS S3, Cloudflare R2,
 * MinIO). The client is expected to carry its own API-call timeout.
 */
public class S3ObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);
    private static final String COLLABORATOR = "object-store";

    private final S3Client s3;
    private final String bucket;

    public S3ObjectStore(S3Client s3, String bucket) {
        this.s3 = s3;
        this.bucket = bucket;
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        try {
            s3.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromBytes(content));
            log.info("Uploaded s3://{}/{} ({} bytes)", bucket, key, content.length);
        } catch (SdkException e) {
            throw failure("PUT", key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            var bytes = s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
            return Optional.of(bytes.asByteArray());
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (SdkException e) {
            throw failure("GET", key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            log.info("Deleted s3://{}/{}", bucket, key);
        } catch (SdkException e) {
            throw failure("DELETE", key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        try {
            var keys = new ArrayList<String>();
            String token = null;
            do {
                var response = s3.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix)
                        .continuationToken(token)
                        .build());
                response.contents().stream().map(S3Object::key).forEach(keys::add);
                token = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
            } while (token != null);
            keys.sort(null);
            return keys;
        } catch (SdkException e) {
            throw failure("LIST", prefix, e);
        }
    }

    @Override
    public String describe() {
        return "s3 bucket " + bucket;
    }

    private UpstreamUnavailableException failure(String operation, String key, SdkException e) {
        log.warn("Object store {} {} failed: {}", operation, key, e.getMessage());
        return new UpstreamUnavailableException(COLLABORATOR,
                "Object store %s %s failed: %s".formatted(operation, key, e.getMessage()), e);
    }
}
