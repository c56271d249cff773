package com.scholary.audio.pipeline.job;

/** A job with the same id is already in flight on this instance. */
public class JobAlreadyRunningException extends PipelineException {

  public JobAlreadyRunningException(String message) {
    super(message);
  }

  public JobAlreadyRunningException(String message, Throwable cause) {
    super(message, cause);
  }
}
