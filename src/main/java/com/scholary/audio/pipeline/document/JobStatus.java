package com.scholary.audio.pipeline.document;

/** Audio status stored on a job document. */
public enum JobStatus {
  PENDING,
  PROCESSING,
  PROCESSED,
  ERROR
}
