package com.scholary.audio.pipeline.stage;

import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.logging.StructuredLogger;
import com.scholary.audio.pipeline.objectstore.ObjectStoreClient;
import com.scholary.audio.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.audio.pipeline.objectstore.ObjectUpload;
import com.scholary.audio.pipeline.objectstore.OutputMetadata;
import com.scholary.audio.pipeline.objectstore.UploadFailureException;
import com.scholary.audio.pipeline.process.DiagnosticListener;
import com.scholary.audio.pipeline.process.DiagnosticParser;
import com.scholary.audio.pipeline.process.ExternalProcessChannel;
import com.scholary.audio.pipeline.process.Futures;
import com.scholary.audio.pipeline.process.ProcessChannelFactory;
import com.scholary.audio.pipeline.process.StdoutMode;
import com.scholary.audio.pipeline.process.StreamPump;
import com.scholary.audio.pipeline.progress.Phase;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs ffmpeg over an acquired input and streams the mp3 straight into the object store.
 *
 * <p>Trimming happens here: the transcoder seeks to the window start and stops after the window
 * duration, unless acquisition already cut the input. Nothing is written to local disk.
 */
@Component
public class TranscodeStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscodeStage.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String TRANSCODER = "ffmpeg";
  static final String TRANSCODING_MESSAGE = "Trimming and Transcoding";
  static final String COPY_MESSAGE = "Trimming";
  private static final long DOWNLOADER_SETTLE_SECONDS = 1;

  private final ProcessChannelFactory channels;
  private final ObjectStoreClient objectStore;
  private final String bucket;
  private final String ffmpeg;
  private final PipelineProperties.Transcode settings;

  public TranscodeStage(
      ProcessChannelFactory channels,
      ObjectStoreClient objectStore,
      ObjectStoreProperties objectStoreProperties,
      PipelineProperties properties) {
    this.channels = channels;
    this.objectStore = objectStore;
    this.bucket = objectStoreProperties.bucket();
    this.ffmpeg = properties.tools().ffmpeg();
    this.settings = properties.transcode();
  }

  /**
   * Transcode (or, in skip mode, stream-copy) the input and publish it under {@code key}.
   *
   * @throws PipelineException if the transcoder, the downloader feeding it or the upload fails
   */
  public TranscodeResult transcode(
      JobSpec job, AcquiredInput input, String key, OutputMetadata metadata, StageContext context) {
    context.token().throwIfRequested("Transcode");
    List<String> command = buildArguments(input, job.skipTranscode());
    STRUCTURED_LOGGER.logPhaseStarted(Phase.TRANSCODE.name(), input.policy().name());
    long startedAt = System.nanoTime();

    String message = job.skipTranscode() ? COPY_MESSAGE : TRANSCODING_MESSAGE;
    TranscodeProgress progress =
        new TranscodeProgress(context, input, message, channels.ioExecutor());
    ExternalProcessChannel downloader = input.downloader();
    try {
      ExternalProcessChannel transcoder =
          channels
              .newChannel(TRANSCODER, command)
              .fatalPatterns(settings.fatalPatterns())
              .cancellationToken(context.token())
              .stdout(StdoutMode.PIPE)
              .listener(progress)
              .start();

      ObjectUpload upload =
          objectStore.openUpload(bucket, key, OutputMetadata.CONTENT_TYPE, metadata);
      if (input.isPipe()) {
        CompletableFuture<Long> feed =
            StreamPump.start(
                downloader.tool() + "->" + TRANSCODER,
                downloader.stdout(),
                transcoder.stdin(),
                true,
                channels.ioExecutor());
        UploadPipe.run(
            transcoder,
            upload,
            channels.ioExecutor(),
            () -> {
              checkFeed(feed);
              checkDownloader(downloader);
            });
      } else {
        transcoder.closeStdin();
        UploadPipe.run(transcoder, upload, channels.ioExecutor());
      }
    } catch (PipelineException e) {
      throw preferDownloaderFailure(downloader, e);
    } finally {
      progress.awaitStatusWrite();
      if (downloader != null) {
        downloader.terminate();
      }
      if (input.tempFile() != null) {
        context.tempResources().release(input.tempFile());
      }
    }
    context.token().throwIfRequested("Transcode");

    STRUCTURED_LOGGER.logPhaseFinished(
        Phase.TRANSCODE.name(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
    return new TranscodeResult(key, progress.outputSeconds());
  }

  /** The ffmpeg command line for an input. */
  List<String> buildArguments(AcquiredInput input, boolean copyOnly) {
    List<String> args = new ArrayList<>();
    args.add(ffmpeg);
    if (!input.isPipe()) {
      args.add("-nostdin");
    }
    String seek =
        input.seekSeconds() > 0 ? DiagnosticParser.formatSeconds(input.seekSeconds()) : null;
    if (input.isPipe()) {
      args.add("-i");
      args.add(input.location());
      if (seek != null) {
        args.add("-ss");
        args.add(seek);
      }
    } else {
      if (seek != null) {
        args.add("-ss");
        args.add(seek);
      }
      args.add("-i");
      args.add(input.location());
    }
    if (input.durationLimitSeconds() != null) {
      args.add("-t");
      args.add(DiagnosticParser.formatSeconds(input.durationLimitSeconds()));
    }

    if (copyOnly) {
      args.add("-c");
      args.add("copy");
    } else {
      args.add("-vn");
      args.add("-acodec");
      args.add(settings.audioCodec());
      args.add("-b:a");
      args.add(settings.bitrate());
      args.add("-ac");
      args.add(String.valueOf(settings.channels()));
      args.add("-ar");
      args.add(String.valueOf(settings.sampleRate()));
      args.add("-af");
      args.add(settings.filterChain());
    }
    args.add("-f");
    args.add("mp3");
    args.add("pipe:1");
    return args;
  }

  /**
   * Before the output is committed: the transcoder also exits cleanly when its input ends because
   * reading from the downloader failed. Only a pipe the transcoder itself closed is harmless; a
   * feed that is still running means the transcoder stopped on its own.
   */
  private static void checkFeed(CompletableFuture<Long> feed) {
    PipelineException failure = Futures.failureOf(feed);
    if (failure != null && !StreamPump.isEarlyPipeClosure(failure)) {
      throw failure;
    }
  }

  /**
   * Before the output is committed: a downloader that already died with a real error may have
   * handed over a truncated stream.
   */
  private static void checkDownloader(ExternalProcessChannel downloader) {
    if (downloader.isAlive()) {
      return;
    }
    CompletableFuture<Integer> completion = downloader.completion();
    try {
      completion.get(DOWNLOADER_SETTLE_SECONDS, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineException("Interrupted while checking " + downloader.tool(), e);
    } catch (TimeoutException e) {
      LOGGER.debug("{} exited but has not settled yet", downloader.tool());
    } catch (ExecutionException | CancellationException e) {
      PipelineException failure = Futures.unwrap(e);
      if (!StreamPump.isEarlyPipeClosure(failure)) {
        throw failure;
      }
      LOGGER.debug("{} hit a closed pipe after the transcoder finished", downloader.tool());
    }
  }

  private static PipelineException preferDownloaderFailure(
      ExternalProcessChannel downloader, PipelineException transcodeFailure) {
    if (downloader == null) {
      return transcodeFailure;
    }
    PipelineException downloadFailure = Futures.failureOf(downloader.completion());
    if (downloadFailure == null
        || downloadFailure == transcodeFailure
        || StreamPump.isEarlyPipeClosure(downloadFailure)
        || transcodeFailure instanceof CancelledException
        || transcodeFailure instanceof UploadFailureException) {
      return transcodeFailure;
    }
    downloadFailure.addSuppressed(transcodeFailure);
    return downloadFailure;
  }

  /**
   * Maps transcoder markers to job progress and flips the status on the first position.
   *
   * <p>Markers arrive on the thread draining the transcoder's stderr, so the status write is handed
   * to the I/O pool. It is awaited before the stage returns so it cannot land after a later status.
   */
  private static final class TranscodeProgress implements DiagnosticListener {

    private final StageContext context;
    private final AcquiredInput input;
    private final String statusMessage;
    private final Executor executor;
    private volatile Double totalSeconds;
    private volatile Double outputSeconds;
    private volatile CompletableFuture<Void> statusWrite = CompletableFuture.completedFuture(null);
    private boolean started;

    TranscodeProgress(
        StageContext context, AcquiredInput input, String statusMessage, Executor executor) {
      this.context = context;
      this.input = input;
      this.statusMessage = statusMessage;
      this.executor = executor;
    }

    @Override
    public void onTotalDuration(long millis) {
      totalSeconds = millis / 1000.0;
      context.progress().onSourceDurationKnown(totalSeconds);
    }

    @Override
    public void onPosition(long millis) {
      if (!started) {
        started = true;
        writeStatus();
        context.progress().beginPhase(Phase.TRANSCODE);
      }
      double position = millis / 1000.0;
      outputSeconds = position;
      Double expected = expectedSeconds();
      if (expected != null && expected > 0) {
        context.progress().report(Phase.TRANSCODE, Math.min(100, position / expected * 100));
      }
    }

    Double outputSeconds() {
      return outputSeconds;
    }

    void awaitStatusWrite() {
      statusWrite.handle((ignored, error) -> null).join();
    }

    private void writeStatus() {
      StatusReporter status = context.status();
      try {
        statusWrite = CompletableFuture.runAsync(() -> status.processing(statusMessage), executor);
      } catch (RejectedExecutionException e) {
        LOGGER.debug("No I/O thread for the status write, writing inline");
        status.processing(statusMessage);
      }
    }

    private Double expectedSeconds() {
      if (input.durationLimitSeconds() != null) {
        return input.durationLimitSeconds();
      }
      Double total = totalSeconds;
      if (total == null) {
        return null;
      }
      return input.seekSeconds() > 0 ? total - input.seekSeconds() : total;
    }
  }
}
