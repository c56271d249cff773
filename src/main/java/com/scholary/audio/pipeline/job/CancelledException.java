package com.scholary.audio.pipeline.job;

/** Thrown when a job's cancellation token was triggered, by timeout or by request. */
public class CancelledException extends PipelineException {

  public CancelledException(String message) {
    super(message);
  }

  public CancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
