package com.scholary.audio.pipeline.objectstore;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. Spring Boot binds and validates them
 * at startup. Multipart parts must be at least 5 MiB, the S3 minimum for all but the last part.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @Min(5) int partSizeMb) {

  public int partSizeBytes() {
    return partSizeMb * 1024 * 1024;
  }
}
