package com.dealwatch.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.charset.StandardCharsets;

/**
 * Seen set stored as a single S3 object holding a UTF-8 JSON array.
 */
public final class S3SeenSetStore implements SeenSetStore {
    private static final Logger LOG = LogManager.getLogger(S3SeenSetStore.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String key;

    public S3SeenSetStore(S3Client s3Client, String bucketName, String key) {
        if (s3Client == null) {
            throw new IllegalArgumentException("S3 client is required");
        }
        if (bucketName == null || bucketName.trim().isEmpty()) {
            throw new IllegalArgumentException("S3 bucket name must be configured (seen.bucket / BUCKET_NAME)");
        }
        this.s3Client = s3Client;
        this.bucketName = bucketName.trim();
        this.key = key == null || key.trim().isEmpty() ? "seen_deals.json" : key.trim();
    }

    public static S3SeenSetStore create(String region, String bucketName, String key) {
        S3Client client = S3Client.builder()
                .region(Region.of(region))
                .build();
        return new S3SeenSetStore(client, bucketName, key);
    }

    @Override
    public LoadResult load() {
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build();
            ResponseBytes<GetObjectResponse> objectBytes = s3Client.getObjectAsBytes(request);
            String text = new String(objectBytes.asByteArray(), StandardCharsets.UTF_8);
            SeenSet seenSet = SeenSet.fromJson(text);
            LOG.info("Loaded {} seen deal id(s) from {}", seenSet.size(), describe());
            return LoadResult.loaded(seenSet);
        } catch (NoSuchKeyException e) {
            LOG.info("No seen set at {}, starting empty", describe());
            return LoadResult.absent();
        } catch (S3Exception e) {
            String message = resolveS3ErrorMessage(e);
            LOG.error("S3 error loading seen deals from {}: {}", describe(), message, e);
            return LoadResult.failed("seen_load_failed: " + message);
        } catch (SdkClientException e) {
            LOG.error("S3 client error loading seen deals from {}: {}", describe(), e.getMessage(), e);
            return LoadResult.failed("seen_load_failed: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unreadable seen set at {}: {}", describe(), e.getMessage());
            return LoadResult.failed("seen_load_failed: " + e.getMessage());
        }
    }

    @Override
    public void save(SeenSet seenSet) {
        byte[] payload = seenSet.toJson().getBytes(StandardCharsets.UTF_8);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .contentType("application/json; charset=utf-8")
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(payload));
            LOG.info("Saved {} seen deals to {}", seenSet.size(), describe());
        } catch (S3Exception e) {
            throw new SeenSetStoreException(
                    "S3 error saving seen set to " + describe() + ": " + resolveS3ErrorMessage(e), e);
        } catch (SdkClientException e) {
            throw new SeenSetStoreException(
                    "S3 client error saving seen set to " + describe() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        s3Client.close();
    }

    @Override
    public String describe() {
        return "s3://" + bucketName + "/" + key;
    }

    private String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return exception.getMessage();
    }
}
