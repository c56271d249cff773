package com.scholary.audio.pipeline.document;

import com.scholary.audio.pipeline.job.PipelineException;

/** The job document never appeared, even after the existence retries. */
public class DocumentNotFoundException extends PipelineException {

  public DocumentNotFoundException(String message) {
    super(message);
  }

  public DocumentNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
