package com.scholary.audio.pipeline.job;

/** The audio source does not fit the requested operation, e.g. copy-trim of a remote URL. */
public class InvalidSourceException extends PipelineException {

  public InvalidSourceException(String message) {
    super(message);
  }

  public InvalidSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
