package com.scholary.audio.pipeline.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListMultipartUploadsRequest;

/** Runs the client against a MinIO container. */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "audio-test";

  @Container
  static GenericContainer<?> minio =
      new GenericContainer<>("minio/minio:RELEASE.2024-05-10T01-41-38Z")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3Client adminClient;
  private static S3ObjectStoreClient client;

  @TempDir Path tempDir;

  @BeforeAll
  static void setUp() {
    String endpoint = String.format("http://%s:%d", minio.getHost(), minio.getMappedPort(9000));
    adminClient =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build();
    adminClient.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true, 5));
  }

  @AfterAll
  static void tearDown() {
    client.close();
    adminClient.close();
  }

  private static void write(ObjectUpload upload, byte[] content) throws Exception {
    try (OutputStream out = upload.outputStream()) {
      out.write(content);
    }
    upload.completion().join();
  }

  @Test
  void upload_shouldPublishSmallObjectWithMetadata() throws Exception {
    String key = "processed-sermons/small";
    write(
        client.openUpload(
            BUCKET,
            key,
            OutputMetadata.CONTENT_TYPE,
            new OutputMetadata(42.5, "Sunday Service", "https://cdn.example/intro.mp3", null)),
        "mp3 bytes".getBytes(StandardCharsets.UTF_8));

    HeadObjectResponse head =
        adminClient.headObject(HeadObjectRequest.builder().bucket(BUCKET).key(key).build());
    assertThat(head.contentType()).isEqualTo("audio/mpeg");
    assertThat(head.contentDisposition()).isEqualTo("inline; filename=\"Sunday Service.mp3\"");
    assertThat(head.metadata())
        .containsEntry("duration", "42.5")
        .containsEntry("title", "Sunday Service")
        .containsEntry("introurl", "https://cdn.example/intro.mp3");

    Path target = tempDir.resolve("small.mp3");
    client.download(BUCKET, key, target);
    assertThat(Files.readString(target)).isEqualTo("mp3 bytes");
  }

  @Test
  void upload_shouldStreamObjectLargerThanOnePart() throws Exception {
    String key = "intro-outro-sermons/large";
    byte[] content = new byte[6 * 1024 * 1024 + 123];
    Arrays.fill(content, (byte) 7);

    write(
        client.openUpload(
            BUCKET, key, OutputMetadata.CONTENT_TYPE, new OutputMetadata(null, null, null, null)),
        content);

    Path target = tempDir.resolve("large.mp3");
    client.download(BUCKET, key, target);
    assertThat(Files.size(target)).isEqualTo(content.length);
  }

  @Test
  void abort_shouldLeaveNoObjectOrPendingUpload() throws Exception {
    String key = "processed-sermons/aborted";
    ObjectUpload upload =
        client.openUpload(
            BUCKET, key, OutputMetadata.CONTENT_TYPE, new OutputMetadata(null, null, null, null));
    upload.outputStream().write(new byte[6 * 1024 * 1024]);

    upload.abort(new IllegalStateException("transcoder failed"));

    assertThat(upload.completion()).isCompletedExceptionally();
    assertThat(client.exists(BUCKET, key)).isFalse();
    assertThat(
            adminClient
                .listMultipartUploads(
                    ListMultipartUploadsRequest.builder().bucket(BUCKET).prefix(key).build())
                .uploads())
        .isEmpty();
  }

  @Test
  void existsAndDelete_shouldReflectStoredObjects() throws Exception {
    String key = "uploads/original.mp3";
    write(
        client.openUpload(
            BUCKET, key, OutputMetadata.CONTENT_TYPE, new OutputMetadata(null, null, null, null)),
        new byte[] {1, 2, 3});

    assertThat(client.exists(BUCKET, key)).isTrue();
    client.delete(BUCKET, key);
    assertThat(client.exists(BUCKET, key)).isFalse();
    client.delete(BUCKET, key);
  }

  @Test
  void download_shouldFailForMissingObject() {
    assertThatThrownBy(() -> client.download(BUCKET, "missing", tempDir.resolve("missing.mp3")))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("Object not found");
  }
}
