package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.job.PipelineException;

/** The OS refused to start a subprocess, typically because the binary is missing. */
public class SpawnFailureException extends PipelineException {

  public SpawnFailureException(String message) {
    super(message);
  }

  public SpawnFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
