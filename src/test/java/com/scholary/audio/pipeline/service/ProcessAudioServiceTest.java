package com.scholary.audio.pipeline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.job.ActiveJobRegistry;
import com.scholary.audio.pipeline.job.AudioSource;
import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.JobAlreadyRunningException;
import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.job.TrimWindow;
import com.scholary.audio.pipeline.process.Futures;
import com.scholary.audio.pipeline.support.TestProperties;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.stubbing.Answer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class ProcessAudioServiceTest {

  @TempDir Path tempDir;

  private final PipelineOrchestrator orchestrator = mock(PipelineOrchestrator.class);
  private final ExecutorService jobExecutor = Executors.newFixedThreadPool(2);
  private final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();

  private ActiveJobRegistry activeJobs;

  @BeforeEach
  void setUp() {
    scheduler.setThreadNamePrefix("test-timeout-");
    scheduler.initialize();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
    jobExecutor.shutdownNow();
  }

  private ProcessAudioService service(long timeoutSeconds) {
    PipelineProperties defaults = TestProperties.pipeline(tempDir);
    PipelineProperties.Job job = defaults.job();
    PipelineProperties properties =
        new PipelineProperties(
            defaults.tools(),
            defaults.transcode(),
            defaults.acquisition(),
            defaults.progress(),
            new PipelineProperties.Job(
                job.tempDir(),
                timeoutSeconds,
                0,
                job.existenceRetries(),
                job.existenceRetryDelayMillis(),
                job.processedPrefix(),
                job.mergedPrefix(),
                job.executorThreads(),
                job.executorQueueSize(),
                job.ioThreads(),
                job.diagnosticTailLines()));
    activeJobs = new ActiveJobRegistry(properties);
    return new ProcessAudioService(orchestrator, activeJobs, jobExecutor, scheduler, properties);
  }

  private static JobSpec job(String id) {
    return new JobSpec(
        id, AudioSource.storedObject("uploads/" + id), TrimWindow.none(), false, false, null,
        null);
  }

  /** Blocks the job until its token is set, then fails like a cancelled stage. */
  private static Answer<PipelineResult> blockUntilCancelled() {
    return invocation -> {
      CancellationToken token = invocation.getArgument(1);
      CountDownLatch cancelled = new CountDownLatch(1);
      token.onCancel(cancelled::countDown);
      if (!cancelled.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("Job was never cancelled");
      }
      token.throwIfRequested("Job");
      return null;
    };
  }

  @Test
  void process_shouldReturnOrchestratorResultAndReleaseId() {
    ProcessAudioService service = service(3600);
    PipelineResult expected = new PipelineResult("a", "processed-sermons/a", 12.0);
    when(orchestrator.run(eq(job("a")), any(CancellationToken.class))).thenReturn(expected);

    assertThat(service.process(job("a"))).isEqualTo(expected);
    assertThat(activeJobs.isActive("a")).isFalse();
  }

  @Test
  void process_shouldSurfacePipelineFailures() {
    ProcessAudioService service = service(3600);
    when(orchestrator.run(any(), any())).thenThrow(new PipelineException("ffmpeg exited with 1"));

    assertThatThrownBy(() -> service.process(job("a")))
        .isInstanceOf(PipelineException.class)
        .hasMessage("ffmpeg exited with 1");
    assertThat(activeJobs.isActive("a")).isFalse();
  }

  @Test
  void submit_shouldRejectSecondJobWithSameIdWhileRunning() {
    ProcessAudioService service = service(3600);
    when(orchestrator.run(any(), any())).thenAnswer(blockUntilCancelled());

    CompletableFuture<PipelineResult> first = service.submit(job("a"));

    assertThatThrownBy(() -> service.submit(job("a")))
        .isInstanceOf(JobAlreadyRunningException.class);
    assertThat(service.cancel("a")).isTrue();
    assertThatThrownBy(() -> Futures.join(first)).isInstanceOf(CancelledException.class);
    assertThat(activeJobs.isActive("a")).isFalse();
  }

  @Test
  void cancel_shouldStopRunningJobWithRequestReason() {
    ProcessAudioService service = service(3600);
    when(orchestrator.run(any(), any())).thenAnswer(blockUntilCancelled());
    CompletableFuture<PipelineResult> running = service.submit(job("a"));

    assertThat(service.cancel("a")).isTrue();

    assertThatThrownBy(() -> Futures.join(running))
        .isInstanceOf(CancelledException.class)
        .hasMessageContaining(ProcessAudioService.CANCELLED_BY_REQUEST);
  }

  @Test
  void cancel_shouldReportUnknownJob() {
    assertThat(service(3600).cancel("nope")).isFalse();
  }

  @Test
  void submit_shouldCancelJobThatExceedsTimeout() {
    ProcessAudioService service = service(1);
    when(orchestrator.run(any(), any())).thenAnswer(blockUntilCancelled());

    assertThatThrownBy(() -> service.process(job("slow")))
        .isInstanceOf(CancelledException.class)
        .hasMessageContaining("Timed out after 1 seconds");
    assertThat(activeJobs.isActive("slow")).isFalse();
  }
}
