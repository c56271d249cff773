package com.scholary.audio.pipeline.objectstore;

import com.scholary.audio.pipeline.job.PipelineException;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: the SDK already retries transient failures, so by the time this surfaces there is
 * nothing left for the caller to do except fail the job.
 */
public class ObjectStoreException extends PipelineException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
