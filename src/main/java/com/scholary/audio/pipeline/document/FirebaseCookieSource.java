package com.scholary.audio.pipeline.document;

import com.scholary.audio.pipeline.config.FirebaseProperties;
import com.scholary.audio.pipeline.stage.CookieSource;
import java.net.URI;
import java.util.Optional;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Reads the shared downloader cookie jar, stored base64 encoded at {@code firebase.cookiesPath}.
 */
public class FirebaseCookieSource implements CookieSource {

  private final RestTemplate restTemplate;
  private final FirebaseProperties properties;

  public FirebaseCookieSource(RestTemplate restTemplate, FirebaseProperties properties) {
    this.restTemplate = restTemplate;
    this.properties = properties;
  }

  @Override
  public Optional<String> encodedCookies() {
    try {
      Object value = restTemplate.getForObject(url(), Object.class);
      return value instanceof String ? Optional.of((String) value) : Optional.empty();
    } catch (RestClientException e) {
      throw new DocumentStoreException("Failed to read downloader cookies: " + e.getMessage(), e);
    }
  }

  URI url() {
    UriComponentsBuilder builder =
        UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
            .pathSegment(properties.cookiesPath() + ".json");
    if (properties.authToken() != null && !properties.authToken().isBlank()) {
      builder.queryParam("auth", properties.authToken());
    }
    return builder.encode().build().toUri();
  }
}
