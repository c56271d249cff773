package com.scholary.audio.pipeline.document;

import java.util.Map;
import java.util.Optional;

/** A job document as read from the store. Missing documents have {@code exists == false}. */
public record DocumentSnapshot(boolean exists, Map<String, Object> fields) {

  public DocumentSnapshot {
    fields = fields == null ? Map.of() : Map.copyOf(fields);
  }

  public static DocumentSnapshot missing() {
    return new DocumentSnapshot(false, Map.of());
  }

  public Optional<String> stringField(String name) {
    Object value = fields.get(name);
    return value instanceof String && !((String) value).isBlank()
        ? Optional.of((String) value)
        : Optional.empty();
  }
}
