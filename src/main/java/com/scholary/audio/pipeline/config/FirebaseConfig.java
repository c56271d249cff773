package com.scholary.audio.pipeline.config;

import com.scholary.audio.pipeline.document.DocumentStore;
import com.scholary.audio.pipeline.document.FirebaseCookieSource;
import com.scholary.audio.pipeline.document.FirestoreAccessToken;
import com.scholary.audio.pipeline.document.FirestoreDocumentStore;
import com.scholary.audio.pipeline.progress.FirebaseProgressSink;
import com.scholary.audio.pipeline.progress.ProgressSink;
import com.scholary.audio.pipeline.stage.CookieSource;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the Firebase adapters.
 *
 * <p>The Firestore document store, the Realtime Database progress sink and the cookie source all
 * talk REST through one RestTemplate. The JDK request factory is used because it supports PATCH.
 */
@Configuration
@EnableConfigurationProperties(FirebaseProperties.class)
public class FirebaseConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(FirebaseConfig.class);

  @Bean
  public RestTemplate firebaseRestTemplate(FirebaseProperties properties) {
    LOGGER.info(
        "Firebase configured: firestore={}, project={}, database={}",
        properties.firestoreBaseUrl(),
        properties.projectId(),
        properties.baseUrl());
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(Duration.ofSeconds(properties.readTimeoutSeconds()));
    return new RestTemplate(requestFactory);
  }

  @Bean
  public FirestoreAccessToken firestoreAccessToken(
      @Qualifier("firebaseRestTemplate") RestTemplate restTemplate, FirebaseProperties properties) {
    return new FirestoreAccessToken(restTemplate, properties);
  }

  @Bean
  public DocumentStore documentStore(
      @Qualifier("firebaseRestTemplate") RestTemplate restTemplate,
      FirebaseProperties properties,
      FirestoreAccessToken accessToken) {
    return new FirestoreDocumentStore(restTemplate, properties, accessToken);
  }

  @Bean
  public ProgressSink progressSink(
      @Qualifier("firebaseRestTemplate") RestTemplate restTemplate, FirebaseProperties properties) {
    return new FirebaseProgressSink(restTemplate, properties);
  }

  @Bean
  public CookieSource downloaderCookieSource(
      @Qualifier("firebaseRestTemplate") RestTemplate restTemplate, FirebaseProperties properties) {
    if (properties.cookiesPath() == null || properties.cookiesPath().isBlank()) {
      return CookieSource.NONE;
    }
    return new FirebaseCookieSource(restTemplate, properties);
  }
}
