package com.scholary.audio.pipeline.logging;

import java.util.UUID;

/**
 * Correlation fields carried through every stage of one job.
 *
 * <p>Immutable; {@link #child(String)} derives a context for a nested operation that keeps the job
 * and request ids.
 */
public record JobContext(String jobId, String requestId, String operation) {

  public static JobContext create(String jobId, String operation) {
    return new JobContext(jobId, UUID.randomUUID().toString(), operation);
  }

  public JobContext child(String childOperation) {
    return new JobContext(jobId, requestId, operation + "." + childOperation);
  }
}
