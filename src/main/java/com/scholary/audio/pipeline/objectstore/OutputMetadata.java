package com.scholary.audio.pipeline.objectstore;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ContentDisposition;

/**
 * Descriptive metadata attached to every published audio object.
 *
 * @param durationSeconds total playable length, null while unknown
 * @param title document title, used for the download file name
 */
public record OutputMetadata(
    Double durationSeconds, String title, String introUrl, String outroUrl) {

  public static final String CONTENT_TYPE = "audio/mpeg";

  private static final String DEFAULT_FILE_NAME = "untitled.mp3";

  public OutputMetadata withDuration(double seconds) {
    return new OutputMetadata(seconds, title, introUrl, outroUrl);
  }

  /** {@code inline; filename="<title>.mp3"}, or {@code untitled.mp3} without a title. */
  public String contentDisposition() {
    String fileName =
        title == null || title.isBlank() ? DEFAULT_FILE_NAME : title.trim() + ".mp3";
    ContentDisposition.Builder builder = ContentDisposition.inline();
    if (isPlainAscii(fileName)) {
      builder.filename(fileName);
    } else {
      builder.filename(fileName, StandardCharsets.UTF_8);
    }
    return builder.build().toString();
  }

  /** User metadata entries. Absent values are left out; values are kept header-safe. */
  public Map<String, String> userMetadata() {
    Map<String, String> metadata = new LinkedHashMap<>();
    if (durationSeconds != null) {
      metadata.put("duration", String.valueOf(durationSeconds));
    }
    putIfPresent(metadata, "title", title);
    putIfPresent(metadata, "introurl", introUrl);
    putIfPresent(metadata, "outrourl", outroUrl);
    return metadata;
  }

  private static void putIfPresent(Map<String, String> metadata, String key, String value) {
    if (value != null && !value.isBlank()) {
      metadata.put(key, headerSafe(value));
    }
  }

  private static String headerSafe(String value) {
    return isPlainAscii(value) ? value : URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static boolean isPlainAscii(String value) {
    return value.chars().allMatch(c -> c >= 0x20 && c < 0x7f);
  }
}
