package com.scholary.audio.pipeline.stage;

import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.TempResourceRegistry;
import com.scholary.audio.pipeline.logging.JobContext;
import com.scholary.audio.pipeline.progress.ProgressAggregator;

/** Per-job collaborators handed to every stage call. */
public record StageContext(
    JobContext job,
    CancellationToken token,
    TempResourceRegistry tempResources,
    ProgressAggregator progress,
    StatusReporter status) {

  public StageContext child(String operation) {
    return new StageContext(job.child(operation), token, tempResources, progress, status);
  }
}
