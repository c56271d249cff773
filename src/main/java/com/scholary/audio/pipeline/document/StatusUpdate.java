package com.scholary.audio.pipeline.document;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the partial field maps for status transitions.
 *
 * <p>The status lives in a nested object so that sibling fields of {@code status} written by other
 * systems survive the update.
 */
public final class StatusUpdate {

  public static final String AUDIO_STATUS = "status.audioStatus";
  public static final String MESSAGE = "status.message";
  public static final String DURATION_SECONDS = "durationSeconds";

  private StatusUpdate() {}

  public static Map<String, Object> processing(String message) {
    return of(JobStatus.PROCESSING, message);
  }

  public static Map<String, Object> processed(double durationSeconds) {
    Map<String, Object> fields = of(JobStatus.PROCESSED, null);
    fields.put(DURATION_SECONDS, durationSeconds);
    return fields;
  }

  public static Map<String, Object> error(String message) {
    return of(JobStatus.ERROR, message);
  }

  private static Map<String, Object> of(JobStatus status, String message) {
    Map<String, Object> fields = new HashMap<>();
    fields.put(AUDIO_STATUS, status.name());
    fields.put(MESSAGE, message);
    return fields;
  }
}
