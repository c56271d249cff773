package com.scholary.audio.pipeline.job;

/**
 * Base type for every failure a processing job can surface.
 *
 * <p>Unchecked because nothing between the stage that detects a failure and the orchestrator that
 * records it can do anything useful with it. The orchestrator catches these, writes the ERROR
 * status and rethrows.
 */
public class PipelineException extends RuntimeException {

  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
