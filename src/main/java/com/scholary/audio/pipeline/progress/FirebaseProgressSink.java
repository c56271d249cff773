package com.scholary.audio.pipeline.progress;

import com.scholary.audio.pipeline.config.FirebaseProperties;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/** Writes progress integers to {@code {databaseUrl}/{progressPath}/{locator}.json}. */
public class FirebaseProgressSink implements ProgressSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(FirebaseProgressSink.class);

  private final RestTemplate restTemplate;
  private final FirebaseProperties properties;

  public FirebaseProgressSink(RestTemplate restTemplate, FirebaseProperties properties) {
    this.restTemplate = restTemplate;
    this.properties = properties;
  }

  @Override
  public void set(String locator, int percent) {
    try {
      restTemplate.put(urlFor(locator), percent);
    } catch (RestClientException e) {
      LOGGER.warn("Failed to write progress {} for {}: {}", percent, locator, e.getMessage());
    }
  }

  @Override
  public void remove(String locator) {
    try {
      restTemplate.delete(urlFor(locator));
      LOGGER.debug("Removed progress entry: {}", locator);
    } catch (RestClientException e) {
      LOGGER.warn("Failed to remove progress entry {}: {}", locator, e.getMessage());
    }
  }

  URI urlFor(String locator) {
    UriComponentsBuilder builder =
        UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
            .pathSegment(properties.progressPath(), locator + ".json");
    if (properties.authToken() != null && !properties.authToken().isBlank()) {
      builder.queryParam("auth", properties.authToken());
    }
    return builder.encode().build().toUri();
  }
}
