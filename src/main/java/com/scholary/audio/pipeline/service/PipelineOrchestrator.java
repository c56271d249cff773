package com.scholary.audio.pipeline.service;

import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.document.DocumentNotFoundException;
import com.scholary.audio.pipeline.document.DocumentSnapshot;
import com.scholary.audio.pipeline.document.DocumentStore;
import com.scholary.audio.pipeline.document.StatusUpdate;
import com.scholary.audio.pipeline.job.AudioSource;
import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.job.TempResourceRegistry;
import com.scholary.audio.pipeline.logging.JobContext;
import com.scholary.audio.pipeline.logging.StructuredLogger;
import com.scholary.audio.pipeline.objectstore.ObjectStoreClient;
import com.scholary.audio.pipeline.objectstore.ObjectStoreException;
import com.scholary.audio.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.audio.pipeline.objectstore.OutputMetadata;
import com.scholary.audio.pipeline.objectstore.UploadFailureException;
import com.scholary.audio.pipeline.process.DiagnosticParser;
import com.scholary.audio.pipeline.process.Futures;
import com.scholary.audio.pipeline.progress.ProgressAggregator;
import com.scholary.audio.pipeline.progress.ProgressSink;
import com.scholary.audio.pipeline.stage.AcquiredInput;
import com.scholary.audio.pipeline.stage.AcquisitionPolicy;
import com.scholary.audio.pipeline.stage.AcquisitionStage;
import com.scholary.audio.pipeline.stage.ClipFetcher;
import com.scholary.audio.pipeline.stage.MediaProbe;
import com.scholary.audio.pipeline.stage.MergeStage;
import com.scholary.audio.pipeline.stage.StageContext;
import com.scholary.audio.pipeline.stage.StatusReporter;
import com.scholary.audio.pipeline.stage.TranscodeResult;
import com.scholary.audio.pipeline.stage.TranscodeStage;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one job from start to finish.
 *
 * <p>The job document moves {@code PENDING -> PROCESSING(message) -> PROCESSED | ERROR(message)}:
 *
 * <ol>
 *   <li>wait for the job document to exist and read its title
 *   <li>acquire the source and transcode it into {@code <processedPrefix><id>}
 *   <li>when an intro or outro is requested, fetch the clips and the processed audio, then merge
 *       them into {@code <mergedPrefix><id>}
 *   <li>mark the document processed with the total duration, push progress to 100 and, when asked,
 *       delete the stored original
 * </ol>
 *
 * <p>Whatever happens, the progress entry is removed and every scratch file the job created is
 * deleted before {@link #run} returns.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String GETTING_DATA = "Getting Data";
  static final String TRIMMING = "Trimming";
  static final String TRIMMING_AND_TRANSCODING = "Trimming and Transcoding";
  static final String DOWNLOADING = "Downloading Audio";
  static final String ADDING_CLIPS = "Adding Intro and Outro";

  private final AcquisitionStage acquisition;
  private final TranscodeStage transcode;
  private final MergeStage merge;
  private final MediaProbe mediaProbe;
  private final ClipFetcher clipFetcher;
  private final DocumentStore documents;
  private final ProgressSink progressSink;
  private final ObjectStoreClient objectStore;
  private final Executor ioExecutor;
  private final String bucket;
  private final PipelineProperties.Job jobSettings;
  private final double acquisitionSpeedRatio;

  public PipelineOrchestrator(
      AcquisitionStage acquisition,
      TranscodeStage transcode,
      MergeStage merge,
      MediaProbe mediaProbe,
      ClipFetcher clipFetcher,
      DocumentStore documents,
      ProgressSink progressSink,
      ObjectStoreClient objectStore,
      @Qualifier("pipelineIoExecutor") Executor ioExecutor,
      ObjectStoreProperties objectStoreProperties,
      PipelineProperties properties) {
    this.acquisition = acquisition;
    this.transcode = transcode;
    this.merge = merge;
    this.mediaProbe = mediaProbe;
    this.clipFetcher = clipFetcher;
    this.documents = documents;
    this.progressSink = progressSink;
    this.objectStore = objectStore;
    this.ioExecutor = ioExecutor;
    this.bucket = objectStoreProperties.bucket();
    this.jobSettings = properties.job();
    this.acquisitionSpeedRatio = properties.progress().acquisitionSpeedRatio();
  }

  /**
   * Run a job to completion.
   *
   * @throws DocumentNotFoundException if the job document never appears
   * @throws PipelineException for every other failure; the document is marked ERROR first
   */
  public PipelineResult run(JobSpec job, CancellationToken token) {
    JobContext jobContext = JobContext.create(job.id(), "process-audio");
    StructuredLogger.setJobContext(jobContext);
    TempResourceRegistry tempResources = new TempResourceRegistry(Paths.get(jobSettings.tempDir()));
    ProgressAggregator progress =
        new ProgressAggregator(progressSink, job.id(), acquisitionSpeedRatio);
    progress.plan(job.trim());
    StageContext context =
        new StageContext(jobContext, token, tempResources, progress, stageStatus(job.id()));

    LOGGER.info(
        "Starting job: source={}, kind={}, trim={}, skipTranscode={}, intro={}, outro={}",
        job.source().locator(),
        job.source().kind(),
        job.trim(),
        job.skipTranscode(),
        job.hasIntro(),
        job.hasOutro());
    try {
      String title = awaitDocument(job.id(), token);
      token.throwIfRequested("Job");
      writeStatus(job.id(), StatusUpdate.processing(GETTING_DATA));
      writeStatus(job.id(), StatusUpdate.processing(acquisitionMessage(job)));

      OutputMetadata metadata =
          new OutputMetadata(
              job.trim().durationSeconds(), title, job.introUrl(), job.outroUrl());
      String processedKey = jobSettings.processedPrefix() + job.id();
      TranscodeResult transcoded =
          acquireAndTranscode(job, processedKey, metadata, context.child("transcode"));

      PipelineResult result;
      if (job.hasAuxiliaryClips()) {
        result = addClips(job, transcoded, metadata, context.child("merge"));
      } else {
        LOGGER.info("No intro or outro, skipping merge");
        double duration = contentDuration(job, transcoded, null, context);
        result = new PipelineResult(job.id(), processedKey, duration);
      }

      token.throwIfRequested("Job");
      writeStatus(job.id(), StatusUpdate.processed(result.durationSeconds()));
      progress.complete();
      deleteOriginalIfRequested(job, processedKey);
      LOGGER.info(
          "Job finished: output={}, duration={}s", result.outputKey(), result.durationSeconds());
      return result;
    } catch (RuntimeException e) {
      PipelineException failure = Futures.unwrap(e);
      STRUCTURED_LOGGER.logJobFailed(
          job.id(), failure.getClass().getSimpleName(), failure.getMessage());
      if (!(failure instanceof DocumentNotFoundException)) {
        reportError(job.id(), failure);
      }
      throw failure;
    } finally {
      progress.remove();
      tempResources.releaseAll();
      StructuredLogger.clearJobContext();
    }
  }

  static String acquisitionMessage(JobSpec job) {
    if (job.skipTranscode()) {
      return TRIMMING;
    }
    return job.source().kind() == AudioSource.Kind.STORED_OBJECT
        ? TRIMMING_AND_TRANSCODING
        : DOWNLOADING;
  }

  /**
   * Acquire and transcode. A failure while reading from a resolved media URL is retried once from
   * a section download; every other failure is final.
   */
  private TranscodeResult acquireAndTranscode(
      JobSpec job, String key, OutputMetadata metadata, StageContext context) {
    AcquiredInput input = acquisition.acquire(job, context);
    try {
      return transcode.transcode(job, input, key, metadata, context);
    } catch (CancelledException | UploadFailureException e) {
      throw e;
    } catch (PipelineException e) {
      if (input.policy() != AcquisitionPolicy.DIRECT_URL) {
        throw e;
      }
      STRUCTURED_LOGGER.logFallback(
          AcquisitionPolicy.DIRECT_URL.name(),
          AcquisitionPolicy.SECTION_DOWNLOAD.name(),
          e.getMessage());
      AcquiredInput section = acquisition.downloadSection(job, context);
      return transcode.transcode(job, section, key, metadata, context);
    }
  }

  /** Fetch processed audio and clips side by side, then merge them in order. */
  private PipelineResult addClips(
      JobSpec job, TranscodeResult transcoded, OutputMetadata metadata, StageContext context) {
    TempResourceRegistry temps = context.tempResources();
    CancellationToken token = context.token();

    CompletableFuture<Path> content =
        async(
            () -> {
              Path target = temps.createTempFile("processed-" + job.id());
              objectStore.download(bucket, transcoded.key(), target);
              return target;
            });
    CompletableFuture<Path> intro =
        job.hasIntro()
            ? async(() -> clipFetcher.fetch(job.introUrl(), temps.createTempFile("intro"), token))
            : CompletableFuture.completedFuture(null);
    CompletableFuture<Path> outro =
        job.hasOutro()
            ? async(() -> clipFetcher.fetch(job.outroUrl(), temps.createTempFile("outro"), token))
            : CompletableFuture.completedFuture(null);
    // Let every fetch settle before failing so no download is still writing during cleanup.
    CompletableFuture.allOf(content, intro, outro).exceptionally(error -> null).join();
    Path contentFile = Futures.join(content);
    Path introFile = Futures.join(intro);
    Path outroFile = Futures.join(outro);
    token.throwIfRequested("Merge");

    List<Path> clips = new ArrayList<>();
    double total = contentDuration(job, transcoded, contentFile, context);
    if (introFile != null) {
      clips.add(introFile);
      total += mediaProbe.durationSeconds(introFile, token);
    }
    clips.add(contentFile);
    if (outroFile != null) {
      clips.add(outroFile);
      total += mediaProbe.durationSeconds(outroFile, token);
    }
    LOGGER.info("Total duration with clips: {}", DiagnosticParser.secondsToTimeFormat(total));

    writeStatus(job.id(), StatusUpdate.processing(ADDING_CLIPS));
    String mergedKey = jobSettings.mergedPrefix() + job.id();
    merge.merge(job.id(), clips, total, mergedKey, metadata.withDuration(total), context);
    return new PipelineResult(job.id(), mergedKey, total);
  }

  /**
   * Length of the processed audio: the requested duration when there was one, else what the
   * transcoder reported, else a probe of the downloaded output.
   */
  private double contentDuration(
      JobSpec job, TranscodeResult transcoded, Path contentFile, StageContext context) {
    if (job.trim().hasDuration()) {
      return job.trim().durationSeconds();
    }
    if (contentFile != null) {
      return mediaProbe.durationSeconds(contentFile, context.token());
    }
    if (transcoded.outputDurationSeconds() != null) {
      return transcoded.outputDurationSeconds();
    }
    Path target = context.tempResources().createTempFile("processed-" + job.id());
    objectStore.download(bucket, transcoded.key(), target);
    try {
      return mediaProbe.durationSeconds(target, context.token());
    } finally {
      context.tempResources().release(target);
    }
  }

  private String awaitDocument(String id, CancellationToken token) {
    int attempts = jobSettings.existenceRetries();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      token.throwIfRequested("Existence check");
      DocumentSnapshot snapshot = documents.get(id);
      if (snapshot.exists()) {
        return snapshot.stringField("title").orElse(null);
      }
      if (attempt < attempts) {
        LOGGER.info(
            "Document {} not found (attempt {}/{}), retrying in {}ms",
            id,
            attempt,
            attempts,
            jobSettings.existenceRetryDelayMillis());
        pause(jobSettings.existenceRetryDelayMillis());
      }
    }
    throw new DocumentNotFoundException(
        String.format("Document %s does not exist after %d attempts", id, attempts));
  }

  private void deleteOriginalIfRequested(JobSpec job, String processedKey) {
    if (!job.deleteOriginal() || job.source().kind() != AudioSource.Kind.STORED_OBJECT) {
      return;
    }
    String original = job.source().locator();
    if (original.equals(processedKey)) {
      LOGGER.info("Original {} is the processed output, keeping it", original);
      return;
    }
    try {
      if (objectStore.exists(bucket, original)) {
        objectStore.delete(bucket, original);
        LOGGER.info("Deleted original audio: {}", original);
      }
    } catch (ObjectStoreException e) {
      LOGGER.warn("Failed to delete original audio {}: {}", original, e.getMessage());
    }
  }

  private void writeStatus(String id, Map<String, Object> update) {
    documents.update(id, update);
    Object message = update.get(StatusUpdate.MESSAGE);
    STRUCTURED_LOGGER.logStatusChange(
        id,
        String.valueOf(update.get(StatusUpdate.AUDIO_STATUS)),
        message == null ? null : message.toString());
  }

  /** Stages change the message only; a failed write must not fail the stage. */
  private StatusReporter stageStatus(String id) {
    return message -> {
      try {
        writeStatus(id, StatusUpdate.processing(message));
      } catch (RuntimeException e) {
        LOGGER.warn("Failed to update status message of {}: {}", id, e.getMessage());
      }
    };
  }

  private void reportError(String id, PipelineException failure) {
    try {
      writeStatus(id, StatusUpdate.error(failure.getMessage()));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to record error status for {}", id, e);
      failure.addSuppressed(e);
    }
  }

  private <T> CompletableFuture<T> async(Supplier<T> task) {
    try {
      return CompletableFuture.supplyAsync(task, ioExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new PipelineException("No I/O thread available for download", e));
    }
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledException("Interrupted while waiting for the job document", e);
    }
  }
}
