package com.scholary.audio.pipeline.process;

/**
 * Receives markers parsed from a subprocess's diagnostic output.
 *
 * <p>Callbacks run on the channel's reader thread. A callback that throws fails the channel and
 * terminates the process.
 */
public interface DiagnosticListener {

  DiagnosticListener NONE = new DiagnosticListener() {};

  /** Current output position, from a {@code time=HH:MM:SS.ff} marker. */
  default void onPosition(long millis) {}

  /** Source duration, from a {@code Duration: HH:MM:SS.ff} marker. Delivered at most once. */
  default void onTotalDuration(long millis) {}

  /** Downloader percentage. */
  default void onPercent(double percent) {}
}
