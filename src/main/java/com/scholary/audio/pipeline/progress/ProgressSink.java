package com.scholary.audio.pipeline.progress;

/**
 * Where live progress values go. Writes are fire and forget: implementations log their own
 * failures and never throw.
 */
public interface ProgressSink {

  void set(String locator, int percent);

  void remove(String locator);
}
