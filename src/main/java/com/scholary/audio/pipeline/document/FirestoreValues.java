package com.scholary.audio.pipeline.document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between plain Java values and Firestore's typed REST value objects, e.g. {@code
 * {"stringValue": "Sunday Service"}}.
 */
final class FirestoreValues {

  private FirestoreValues() {}

  /** Decodes a document's {@code fields} object. Null values are left out. */
  static Map<String, Object> decodeFields(Map<String, Object> fields) {
    Map<String, Object> decoded = new LinkedHashMap<>();
    if (fields == null) {
      return decoded;
    }
    fields.forEach(
        (name, value) -> {
          Object plain = decode(value);
          if (plain != null) {
            decoded.put(name, plain);
          }
        });
    return decoded;
  }

  /** Encodes plain values into a {@code fields} object. */
  static Map<String, Object> encodeFields(Map<String, Object> fields) {
    Map<String, Object> encoded = new LinkedHashMap<>();
    fields.forEach((name, value) -> encoded.put(name, encode(value)));
    return encoded;
  }

  @SuppressWarnings("unchecked")
  static Object decode(Object value) {
    if (!(value instanceof Map)) {
      return null;
    }
    Map<String, Object> typed = (Map<String, Object>) value;
    if (typed.containsKey("stringValue")) {
      return typed.get("stringValue");
    }
    if (typed.containsKey("integerValue")) {
      return Long.parseLong(String.valueOf(typed.get("integerValue")));
    }
    if (typed.containsKey("doubleValue")) {
      Object number = typed.get("doubleValue");
      return number instanceof Number
          ? ((Number) number).doubleValue()
          : Double.parseDouble(String.valueOf(number));
    }
    if (typed.containsKey("booleanValue")) {
      return Boolean.valueOf(String.valueOf(typed.get("booleanValue")));
    }
    if (typed.containsKey("timestampValue")) {
      return typed.get("timestampValue");
    }
    if (typed.containsKey("referenceValue")) {
      return typed.get("referenceValue");
    }
    if (typed.containsKey("mapValue")) {
      Map<String, Object> map = (Map<String, Object>) typed.get("mapValue");
      return decodeFields(map == null ? null : (Map<String, Object>) map.get("fields"));
    }
    if (typed.containsKey("arrayValue")) {
      Map<String, Object> array = (Map<String, Object>) typed.get("arrayValue");
      List<Object> decoded = new ArrayList<>();
      Object values = array == null ? null : array.get("values");
      if (values instanceof Collection) {
        for (Object element : (Collection<Object>) values) {
          decoded.add(decode(element));
        }
      }
      return decoded;
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> encode(Object value) {
    Map<String, Object> typed = new LinkedHashMap<>();
    if (value == null) {
      typed.put("nullValue", null);
    } else if (value instanceof String || value instanceof Enum) {
      typed.put("stringValue", value instanceof Enum ? ((Enum<?>) value).name() : value);
    } else if (value instanceof Boolean) {
      typed.put("booleanValue", value);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      typed.put("integerValue", String.valueOf(value));
    } else if (value instanceof Number) {
      typed.put("doubleValue", ((Number) value).doubleValue());
    } else if (value instanceof Map) {
      typed.put("mapValue", Map.of("fields", encodeFields((Map<String, Object>) value)));
    } else if (value instanceof Collection) {
      List<Object> values = new ArrayList<>();
      for (Object element : (Collection<Object>) value) {
        values.add(encode(element));
      }
      typed.put("arrayValue", Map.of("values", values));
    } else {
      throw new IllegalArgumentException("Unsupported field value: " + value.getClass().getName());
    }
    return typed;
  }
}
