package com.scholary.audio.pipeline.job;

/**
 * Start offset plus optional duration, both in seconds.
 *
 * <p>A window with start 0 and no duration means "the whole source".
 */
public record TrimWindow(double startSeconds, Double durationSeconds) {

  public TrimWindow {
    if (Double.isNaN(startSeconds) || Double.isInfinite(startSeconds) || startSeconds < 0) {
      throw new IllegalArgumentException("startSeconds must be a finite value >= 0");
    }
    if (durationSeconds != null
        && (durationSeconds.isNaN() || durationSeconds.isInfinite() || durationSeconds <= 0)) {
      throw new IllegalArgumentException("durationSeconds must be a finite value > 0");
    }
  }

  public static TrimWindow none() {
    return new TrimWindow(0, null);
  }

  public static TrimWindow of(double startSeconds, Double durationSeconds) {
    return new TrimWindow(startSeconds, durationSeconds);
  }

  public boolean isTrimming() {
    return startSeconds > 0 || durationSeconds != null;
  }

  public boolean hasDuration() {
    return durationSeconds != null;
  }

  /** End offset, or null when the window runs to the end of the source. */
  public Double endSeconds() {
    return durationSeconds == null ? null : startSeconds + durationSeconds;
  }
}
