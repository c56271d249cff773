package com.scholary.audio.pipeline.objectstore;

/** A streamed upload did not complete, or was aborted because its producer failed. */
public class UploadFailureException extends ObjectStoreException {

  public UploadFailureException(String message) {
    super(message);
  }

  public UploadFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
