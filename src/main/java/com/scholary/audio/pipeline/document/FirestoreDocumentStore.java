package com.scholary.audio.pipeline.document;

import com.scholary.audio.pipeline.config.FirebaseProperties;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Job documents in Cloud Firestore, accessed over its REST API.
 *
 * <p>A 404 on read is a missing document. Updates PATCH the document with an update mask naming
 * exactly the given field paths, so every other field, including siblings inside nested maps,
 * is left alone. A masked path with no value in the body is deleted. Updates never create a
 * document.
 */
public class FirestoreDocumentStore implements DocumentStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreDocumentStore.class);
  private static final ParameterizedTypeReference<Map<String, Object>> DOCUMENT_TYPE =
      new ParameterizedTypeReference<>() {};

  private final RestTemplate restTemplate;
  private final FirebaseProperties properties;
  private final FirestoreAccessToken accessToken;

  public FirestoreDocumentStore(
      RestTemplate restTemplate, FirebaseProperties properties, FirestoreAccessToken accessToken) {
    this.restTemplate = restTemplate;
    this.properties = properties;
    this.accessToken = accessToken;
  }

  @Override
  @SuppressWarnings("unchecked")
  public DocumentSnapshot get(String id) {
    URI url = documentUrl(id).encode().build().toUri();
    try {
      ResponseEntity<Map<String, Object>> response =
          restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), DOCUMENT_TYPE);
      Map<String, Object> body = response.getBody();
      if (body == null) {
        LOGGER.debug("Document not found: {}", id);
        return DocumentSnapshot.missing();
      }
      Object fields = body.get("fields");
      return new DocumentSnapshot(
          true,
          FirestoreValues.decodeFields(
              fields instanceof Map ? (Map<String, Object>) fields : null));
    } catch (HttpClientErrorException.NotFound e) {
      LOGGER.debug("Document not found: {}", id);
      return DocumentSnapshot.missing();
    } catch (RestClientException e) {
      String message =
          String.format("Failed to read document: id=%s, error=%s", id, e.getMessage());
      LOGGER.error(message);
      throw new DocumentStoreException(message, e);
    }
  }

  @Override
  public void update(String id, Map<String, Object> fields) {
    URI url = updateUrl(id, fields);
    Map<String, Object> document = Map.of("fields", FirestoreValues.encodeFields(nest(fields)));
    try {
      restTemplate.exchange(
          url, HttpMethod.PATCH, new HttpEntity<>(document, headers()), DOCUMENT_TYPE);
      LOGGER.debug("Updated document {}: {}", id, fields.keySet());
    } catch (RestClientException e) {
      String message =
          String.format("Failed to update document: id=%s, error=%s", id, e.getMessage());
      LOGGER.error(message);
      throw new DocumentStoreException(message, e);
    }
  }

  URI updateUrl(String id, Map<String, Object> fields) {
    return documentUrl(id)
        .queryParam("updateMask.fieldPaths", fields.keySet().toArray())
        .queryParam("currentDocument.exists", true)
        .encode()
        .build()
        .toUri();
  }

  UriComponentsBuilder documentUrl(String id) {
    return UriComponentsBuilder.fromHttpUrl(properties.firestoreBaseUrl())
        .pathSegment(
            "projects",
            properties.projectId(),
            "databases",
            "(default)",
            "documents",
            properties.documentsCollection(),
            id);
  }

  private HttpHeaders headers() {
    HttpHeaders headers = new HttpHeaders();
    accessToken.token().ifPresent(headers::setBearerAuth);
    return headers;
  }

  /** Turns dotted field paths into nested maps. Null values stay out of the body. */
  @SuppressWarnings("unchecked")
  static Map<String, Object> nest(Map<String, Object> fields) {
    Map<String, Object> root = new LinkedHashMap<>();
    fields.forEach(
        (path, value) -> {
          if (value == null) {
            return;
          }
          String[] segments = path.split("\\.");
          Map<String, Object> parent = root;
          for (int i = 0; i < segments.length - 1; i++) {
            parent =
                (Map<String, Object>)
                    parent.computeIfAbsent(segments[i], key -> new LinkedHashMap<String, Object>());
          }
          parent.put(segments[segments.length - 1], value);
        });
    return root;
  }
}
