package com.scholary.audio.pipeline.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>Uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO; the
 * difference is the endpoint and path-style access configuration. The SDK retries transient
 * failures itself. Uploads stream through {@link S3StreamingUpload}, since transcoder output has
 * no known length up front.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final int partSizeBytes;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties), properties.partSizeBytes());
  }

  S3ObjectStoreClient(S3Client s3Client, int partSizeBytes) {
    this.s3Client = s3Client;
    this.partSizeBytes = partSizeBytes;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public void download(String bucket, String key, Path target) {
    LOGGER.debug("Downloading object: bucket={}, key={}, target={}", bucket, key, target);

    GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
    try (InputStream stream = s3Client.getObject(request)) {
      long bytes = Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.info("Downloaded object: bucket={}, key={}, bytes={}", bucket, key, bytes);

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to download object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error downloading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public ObjectUpload openUpload(
      String bucket, String key, String contentType, OutputMetadata metadata) {
    LOGGER.debug("Opening upload: bucket={}, key={}, contentType={}", bucket, key, contentType);
    return new S3StreamingUpload(s3Client, bucket, key, contentType, metadata, partSizeBytes);
  }

  @Override
  public boolean exists(String bucket, String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;

    } catch (NoSuchKeyException e) {
      return false;

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      String message =
          String.format(
              "Failed to check object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void delete(String bucket, String key) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /** Release connections and threads. Called by Spring on shutdown. */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
