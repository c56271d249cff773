package com.scholary.audio.pipeline.service;

import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.job.ActiveJobRegistry;
import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.JobAlreadyRunningException;
import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.process.Futures;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Entry point for running jobs.
 *
 * <p>Jobs run on the job pool, at most one per id. Each job gets a timer that cancels it once it
 * exceeds the configured budget; the job then fails like any cancelled job.
 */
@Service
public class ProcessAudioService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessAudioService.class);

  static final String CANCELLED_BY_REQUEST = "Cancelled by request";

  private final PipelineOrchestrator orchestrator;
  private final ActiveJobRegistry activeJobs;
  private final Executor jobExecutor;
  private final TaskScheduler scheduler;
  private final long timeoutSeconds;

  public ProcessAudioService(
      PipelineOrchestrator orchestrator,
      ActiveJobRegistry activeJobs,
      @Qualifier("pipelineJobExecutor") Executor jobExecutor,
      @Qualifier("pipelineScheduler") TaskScheduler scheduler,
      PipelineProperties properties) {
    this.orchestrator = orchestrator;
    this.activeJobs = activeJobs;
    this.jobExecutor = jobExecutor;
    this.scheduler = scheduler;
    this.timeoutSeconds = properties.job().effectiveTimeoutSeconds();
  }

  /**
   * Start a job in the background.
   *
   * @throws JobAlreadyRunningException if a job with the same id is still running
   * @throws PipelineException if the job pool is saturated
   */
  public CompletableFuture<PipelineResult> submit(JobSpec job) {
    CancellationToken token = activeJobs.register(job.id());
    ScheduledFuture<?> timer =
        scheduler.schedule(
            () -> {
              String reason = "Timed out after " + timeoutSeconds + " seconds";
              if (token.requestCancellation(reason)) {
                LOGGER.warn("Job {} timed out after {}s, cancelling", job.id(), timeoutSeconds);
              }
            },
            Instant.now().plusSeconds(timeoutSeconds));

    try {
      return CompletableFuture.supplyAsync(() -> orchestrator.run(job, token), jobExecutor)
          .whenComplete(
              (result, error) -> {
                timer.cancel(false);
                activeJobs.unregister(job.id(), token);
              });
    } catch (RejectedExecutionException e) {
      timer.cancel(false);
      activeJobs.unregister(job.id(), token);
      throw new PipelineException("Too many jobs queued, rejected job " + job.id(), e);
    }
  }

  /** Run a job and wait for it. Failures surface as {@link PipelineException}s. */
  public PipelineResult process(JobSpec job) {
    return Futures.join(submit(job));
  }

  /** Request cancellation of a running job. Returns false if no job with that id is running. */
  public boolean cancel(String jobId) {
    boolean found = activeJobs.cancel(jobId, CANCELLED_BY_REQUEST);
    if (found) {
      LOGGER.info("Cancellation requested for job {}", jobId);
    }
    return found;
  }
}
