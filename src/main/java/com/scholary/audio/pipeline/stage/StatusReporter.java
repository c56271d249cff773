package com.scholary.audio.pipeline.stage;

/** Lets a stage change the human-readable status message of its job. Must not throw. */
@FunctionalInterface
public interface StatusReporter {

  StatusReporter NONE = message -> {};

  void processing(String message);
}
