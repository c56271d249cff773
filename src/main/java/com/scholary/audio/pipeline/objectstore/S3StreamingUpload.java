package com.scholary.audio.pipeline.objectstore;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

/**
 * Streams bytes of unknown total length into S3.
 *
 * <p>Bytes are buffered up to one part. The multipart upload is only created once the first part
 * fills up; an object that never reaches one part is sent with a single PUT on close. Parts are
 * uploaded on the writing thread, so a slow store slows the producer down instead of growing the
 * buffer.
 */
class S3StreamingUpload implements ObjectUpload {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3StreamingUpload.class);

  private final S3Client s3Client;
  private final String bucket;
  private final String key;
  private final String contentType;
  private final OutputMetadata metadata;
  private final int partSize;

  private final ByteArrayOutputStream buffer;
  private final List<CompletedPart> parts = new ArrayList<>();
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private final OutputStream stream = new UploadStream();

  private String uploadId;
  private boolean closed;
  private long bytesWritten;

  S3StreamingUpload(
      S3Client s3Client,
      String bucket,
      String key,
      String contentType,
      OutputMetadata metadata,
      int partSize) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.key = key;
    this.contentType = contentType;
    this.metadata = metadata;
    this.partSize = partSize;
    this.buffer = new ByteArrayOutputStream(Math.min(partSize, 1024 * 1024));
  }

  @Override
  public OutputStream outputStream() {
    return stream;
  }

  @Override
  public CompletableFuture<Void> completion() {
    return completion;
  }

  @Override
  public synchronized void abort(Throwable cause) {
    if (completion.isDone()) {
      return;
    }
    closed = true;
    buffer.reset();
    abortMultipart();
    String reason = cause == null ? "aborted" : cause.getMessage();
    LOGGER.warn("Upload aborted: bucket={}, key={}, reason={}", bucket, key, reason);
    completion.completeExceptionally(
        new UploadFailureException(
            String.format("Upload aborted: bucket=%s, key=%s, reason=%s", bucket, key, reason),
            cause));
  }

  private synchronized void write(byte[] bytes, int offset, int length) throws IOException {
    if (closed) {
      throw new IOException("Stream closed");
    }
    int remaining = length;
    int position = offset;
    while (remaining > 0) {
      int chunk = Math.min(remaining, partSize - buffer.size());
      buffer.write(bytes, position, chunk);
      position += chunk;
      remaining -= chunk;
      bytesWritten += chunk;
      if (buffer.size() >= partSize) {
        uploadBufferedPart();
      }
    }
  }

  private synchronized void finish() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (uploadId == null) {
        PutObjectRequest request =
            PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentDisposition(metadata.contentDisposition())
                .metadata(metadata.userMetadata())
                .build();
        s3Client.putObject(request, RequestBody.fromBytes(buffer.toByteArray()));
      } else {
        if (buffer.size() > 0) {
          uploadBufferedPart();
        }
        CompleteMultipartUploadRequest request =
            CompleteMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .uploadId(uploadId)
                .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                .build();
        s3Client.completeMultipartUpload(request);
      }
      buffer.reset();
      LOGGER.info(
          "Successfully uploaded object: bucket={}, key={}, bytes={}", bucket, key, bytesWritten);
      completion.complete(null);
    } catch (SdkException e) {
      throw failed("Failed to complete upload", e);
    }
  }

  private void uploadBufferedPart() throws IOException {
    try {
      if (uploadId == null) {
        CreateMultipartUploadRequest request =
            CreateMultipartUploadRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentDisposition(metadata.contentDisposition())
                .metadata(metadata.userMetadata())
                .build();
        uploadId = s3Client.createMultipartUpload(request).uploadId();
        LOGGER.debug(
            "Started multipart upload: bucket={}, key={}, uploadId={}", bucket, key, uploadId);
      }
      int partNumber = parts.size() + 1;
      UploadPartRequest request =
          UploadPartRequest.builder()
              .bucket(bucket)
              .key(key)
              .uploadId(uploadId)
              .partNumber(partNumber)
              .build();
      UploadPartResponse response =
          s3Client.uploadPart(request, RequestBody.fromBytes(buffer.toByteArray()));
      parts.add(CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build());
      buffer.reset();
    } catch (SdkException e) {
      throw failed("Failed to upload part", e);
    }
  }

  private IOException failed(String what, SdkException cause) {
    String message = String.format("%s: bucket=%s, key=%s", what, bucket, key);
    LOGGER.error(message, cause);
    closed = true;
    abortMultipart();
    UploadFailureException failure = new UploadFailureException(message, cause);
    completion.completeExceptionally(failure);
    return new IOException(message, failure);
  }

  private void abortMultipart() {
    if (uploadId == null) {
      return;
    }
    try {
      s3Client.abortMultipartUpload(
          AbortMultipartUploadRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build());
    } catch (SdkException e) {
      LOGGER.warn(
          "Failed to abort multipart upload: bucket={}, key={}, uploadId={}: {}",
          bucket,
          key,
          uploadId,
          e.getMessage());
    }
    uploadId = null;
  }

  private final class UploadStream extends OutputStream {

    @Override
    public void write(int b) throws IOException {
      S3StreamingUpload.this.write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
      S3StreamingUpload.this.write(bytes, offset, length);
    }

    @Override
    public void close() throws IOException {
      finish();
    }
  }
}
