package com.scholary.audio.pipeline.document;

import com.scholary.audio.pipeline.job.PipelineException;

/** The document store could not be read or written. */
public class DocumentStoreException extends PipelineException {

  public DocumentStoreException(String message) {
    super(message);
  }

  public DocumentStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
