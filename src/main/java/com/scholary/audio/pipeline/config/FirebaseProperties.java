package com.scholary.audio.pipeline.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the two Firebase back ends.
 *
 * <p>Job documents live in the Firestore collection {@code documentsCollection} of {@code
 * projectId}. Requests carry {@code accessToken} as a bearer token, or, when it is blank, a token
 * fetched from {@code metadataTokenUrl}; with neither set they go out unauthenticated, which is
 * what the emulator expects.
 *
 * <p>Live progress values are written to the Realtime Database under {@code progressPath}. {@code
 * cookiesPath}, when set, names the node holding the downloader's cookie jar. The database auth
 * token is optional and appended as the {@code auth} query parameter.
 */
@ConfigurationProperties(prefix = "firebase")
@Validated
public record FirebaseProperties(
    @NotBlank String databaseUrl,
    @NotBlank String progressPath,
    String cookiesPath,
    String authToken,
    @NotBlank String firestoreUrl,
    @NotBlank String projectId,
    @NotBlank String documentsCollection,
    String accessToken,
    String metadataTokenUrl,
    @Positive int connectTimeoutSeconds,
    @Positive int readTimeoutSeconds) {

  /** Database URL without trailing slashes. */
  public String baseUrl() {
    return databaseUrl.replaceAll("/+$", "");
  }

  /** Firestore API root without trailing slashes. */
  public String firestoreBaseUrl() {
    return firestoreUrl.replaceAll("/+$", "");
  }
}
