package com.scholary.audio.pipeline.api;

import com.scholary.audio.pipeline.service.PipelineResult;

/** Returned when a job finished successfully. */
public record ProcessAudioResponse(String id, String outputKey, double durationSeconds) {

  static ProcessAudioResponse from(PipelineResult result) {
    return new ProcessAudioResponse(
        result.jobId(), result.outputKey(), result.durationSeconds());
  }
}
