package com.scholary.audio.pipeline.stage;

import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.logging.StructuredLogger;
import com.scholary.audio.pipeline.objectstore.ObjectStoreClient;
import com.scholary.audio.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.audio.pipeline.objectstore.ObjectUpload;
import com.scholary.audio.pipeline.objectstore.OutputMetadata;
import com.scholary.audio.pipeline.process.DiagnosticListener;
import com.scholary.audio.pipeline.process.ExternalProcessChannel;
import com.scholary.audio.pipeline.process.ProcessChannelFactory;
import com.scholary.audio.pipeline.process.StdoutMode;
import com.scholary.audio.pipeline.progress.Phase;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Concatenates intro, content and outro without re-encoding and publishes the result. */
@Component
public class MergeStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(MergeStage.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String TRANSCODER = "ffmpeg";

  private final ProcessChannelFactory channels;
  private final ObjectStoreClient objectStore;
  private final String bucket;
  private final String ffmpeg;
  private final List<String> fatalPatterns;

  public MergeStage(
      ProcessChannelFactory channels,
      ObjectStoreClient objectStore,
      ObjectStoreProperties objectStoreProperties,
      PipelineProperties properties) {
    this.channels = channels;
    this.objectStore = objectStore;
    this.bucket = objectStoreProperties.bucket();
    this.ffmpeg = properties.tools().ffmpeg();
    this.fatalPatterns = properties.transcode().fatalPatterns();
  }

  /**
   * Merge local clips, in order, into one object.
   *
   * @param clips intro (optional), content, outro (optional)
   * @param totalDurationSeconds sum of the clip durations, used for progress
   */
  public void merge(
      String jobId,
      List<Path> clips,
      double totalDurationSeconds,
      String key,
      OutputMetadata metadata,
      StageContext context) {
    if (clips.isEmpty()) {
      throw new IllegalArgumentException("Nothing to merge");
    }
    context.token().throwIfRequested("Merge");
    context.progress().beginPhase(Phase.MERGE);
    STRUCTURED_LOGGER.logPhaseStarted(Phase.MERGE.name(), clips.size() + " clips");
    long startedAt = System.nanoTime();

    Path listFile = writeConcatList(jobId, clips, context);
    try {
      List<String> command =
          List.of(
              ffmpeg, "-nostdin", "-f", "concat", "-safe", "0", "-i", listFile.toString(), "-c",
              "copy", "-f", "mp3", "pipe:1");
      ExternalProcessChannel channel =
          channels
              .newChannel(TRANSCODER, command)
              .fatalPatterns(fatalPatterns)
              .cancellationToken(context.token())
              .stdout(StdoutMode.PIPE)
              .listener(mergeProgress(context, totalDurationSeconds))
              .start();
      channel.closeStdin();
      ObjectUpload upload =
          objectStore.openUpload(bucket, key, OutputMetadata.CONTENT_TYPE, metadata);
      UploadPipe.run(channel, upload, channels.ioExecutor());
    } finally {
      context.tempResources().release(listFile);
    }

    STRUCTURED_LOGGER.logPhaseFinished(
        Phase.MERGE.name(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
  }

  /** One {@code file '<path>'} line per clip. */
  static String concatList(List<Path> clips) {
    return clips.stream()
        .map(clip -> "file '" + clip.toAbsolutePath().toString().replace("'", "'\\''") + "'")
        .collect(Collectors.joining("\n", "", "\n"));
  }

  private static Path writeConcatList(String jobId, List<Path> clips, StageContext context) {
    Path listFile = context.tempResources().createTempFile("concat-" + jobId + ".txt");
    try {
      Files.writeString(listFile, concatList(clips), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PipelineException("Failed to write concat list " + listFile, e);
    }
    LOGGER.debug("Concat list written: {}", listFile);
    return listFile;
  }

  private static DiagnosticListener mergeProgress(StageContext context, double totalSeconds) {
    return new DiagnosticListener() {
      @Override
      public void onPosition(long millis) {
        if (totalSeconds > 0) {
          double percent = millis / 1000.0 / totalSeconds * 100;
          context.progress().report(Phase.MERGE, Math.min(100, percent));
        }
      }
    };
  }
}
