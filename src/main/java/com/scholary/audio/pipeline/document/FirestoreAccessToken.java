package com.scholary.audio.pipeline.document;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audio.pipeline.config.FirebaseProperties;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Supplies the bearer token for Firestore requests.
 *
 * <p>A configured token is used as is. Otherwise, when a metadata token URL is configured, the
 * service account token is fetched from it and reused until shortly before it would expire.
 */
public class FirestoreAccessToken {

  private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreAccessToken.class);
  private static final ParameterizedTypeReference<Map<String, Object>> TOKEN_TYPE =
      new ParameterizedTypeReference<>() {};

  static final Duration REUSE_FOR = Duration.ofMinutes(45);
  private static final String CACHE_KEY = "token";

  private final RestTemplate restTemplate;
  private final String staticToken;
  private final String metadataTokenUrl;
  private final Cache<String, String> tokens =
      Caffeine.newBuilder().expireAfterWrite(REUSE_FOR).build();

  public FirestoreAccessToken(RestTemplate restTemplate, FirebaseProperties properties) {
    this.restTemplate = restTemplate;
    this.staticToken = blankToNull(properties.accessToken());
    this.metadataTokenUrl = blankToNull(properties.metadataTokenUrl());
  }

  /**
   * The token to send, if any.
   *
   * @throws DocumentStoreException if the metadata server cannot issue one
   */
  public Optional<String> token() {
    if (staticToken != null) {
      return Optional.of(staticToken);
    }
    if (metadataTokenUrl == null) {
      return Optional.empty();
    }
    return Optional.of(tokens.get(CACHE_KEY, key -> fetch()));
  }

  private String fetch() {
    HttpHeaders headers = new HttpHeaders();
    headers.set("Metadata-Flavor", "Google");
    try {
      Map<String, Object> body =
          restTemplate
              .exchange(
                  URI.create(metadataTokenUrl),
                  HttpMethod.GET,
                  new HttpEntity<>(headers),
                  TOKEN_TYPE)
              .getBody();
      Object token = body == null ? null : body.get("access_token");
      if (!(token instanceof String)) {
        throw new DocumentStoreException("Metadata server returned no access token");
      }
      LOGGER.debug("Fetched Firestore access token, expires_in={}", body.get("expires_in"));
      return (String) token;
    } catch (RestClientException e) {
      throw new DocumentStoreException("Failed to fetch access token: " + e.getMessage(), e);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
