package com.scholary.audio.pipeline.stage;

import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.job.AudioSource;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.InvalidSourceException;
import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.job.TrimWindow;
import com.scholary.audio.pipeline.logging.StructuredLogger;
import com.scholary.audio.pipeline.objectstore.ObjectStoreClient;
import com.scholary.audio.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.audio.pipeline.process.DiagnosticListener;
import com.scholary.audio.pipeline.process.DiagnosticParser;
import com.scholary.audio.pipeline.process.ExternalProcessChannel;
import com.scholary.audio.pipeline.process.ProcessChannelFactory;
import com.scholary.audio.pipeline.process.StdoutMode;
import com.scholary.audio.pipeline.progress.Phase;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gets the job's audio into a form the transcoder can read.
 *
 * <p>Four policies, picked from the source kind and the trim window:
 *
 * <ul>
 *   <li>stored object: copy it to a scratch file; the transcoder seeks in the file
 *   <li>remote, trimmed: ask yt-dlp for the direct media URL and let the transcoder seek into it
 *       over HTTP, which avoids downloading everything before the window
 *   <li>remote, trimmed, when the direct URL cannot be resolved or used: download only the section,
 *       then measure it, because cuts land on keyframes and may overshoot
 *   <li>remote, untrimmed: stream the whole download into the transcoder's stdin
 * </ul>
 */
@Component
public class AcquisitionStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(AcquisitionStage.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String DOWNLOADER = "yt-dlp";

  private final ProcessChannelFactory channels;
  private final ObjectStoreClient objectStore;
  private final MediaProbe mediaProbe;
  private final DownloaderCookies cookies;
  private final String bucket;
  private final String ytdlp;
  private final List<String> fatalPatterns;
  private final int connections;
  private final double durationToleranceSeconds;

  public AcquisitionStage(
      ProcessChannelFactory channels,
      ObjectStoreClient objectStore,
      MediaProbe mediaProbe,
      DownloaderCookies cookies,
      ObjectStoreProperties objectStoreProperties,
      PipelineProperties properties) {
    this.channels = channels;
    this.objectStore = objectStore;
    this.mediaProbe = mediaProbe;
    this.cookies = cookies;
    this.bucket = objectStoreProperties.bucket();
    this.ytdlp = properties.tools().ytdlp();
    this.fatalPatterns = properties.acquisition().downloaderFatalPatterns();
    this.connections = properties.acquisition().connections();
    this.durationToleranceSeconds = properties.acquisition().durationToleranceSeconds();
  }

  /**
   * Acquire the input for the transcoder.
   *
   * @throws InvalidSourceException if a copy-only trim is requested for a remote source
   */
  public AcquiredInput acquire(JobSpec job, StageContext context) {
    context.token().throwIfRequested("Acquisition");
    AudioSource source = job.source();
    TrimWindow trim = job.trim();

    switch (source.kind()) {
      case STORED_OBJECT:
        return copyStoredObject(job, context);
      case REMOTE_URL:
        if (job.skipTranscode()) {
          throw new InvalidSourceException(
              "Trimming without transcoding needs a stored object, got URL: " + source.locator());
        }
        if (!trim.isTrimming()) {
          return streamFullSource(source, context);
        }
        try {
          return resolveDirectUrl(source, trim, context);
        } catch (CancelledException e) {
          throw e;
        } catch (PipelineException e) {
          STRUCTURED_LOGGER.logFallback(
              AcquisitionPolicy.DIRECT_URL.name(),
              AcquisitionPolicy.SECTION_DOWNLOAD.name(),
              e.getMessage());
          return downloadSection(job, context);
        }
      default:
        throw new IllegalStateException("Unhandled audio source kind: " + source.kind());
    }
  }

  /** Copy the stored object to a scratch file named after the job. */
  AcquiredInput copyStoredObject(JobSpec job, StageContext context) {
    Path target = context.tempResources().createTempFile("raw-" + job.id());
    LOGGER.info("Copying stored object: bucket={}, key={}", bucket, job.source().locator());
    objectStore.download(bucket, job.source().locator(), target);
    context.token().throwIfRequested("Acquisition");
    context.progress().report(Phase.ACQUISITION, 100);
    TrimWindow trim = job.trim();
    return AcquiredInput.file(
        AcquisitionPolicy.STORED_OBJECT,
        target,
        trim.startSeconds(),
        trim.durationSeconds(),
        false);
  }

  /** Resolve the best audio stream's direct URL without downloading anything. */
  AcquiredInput resolveDirectUrl(AudioSource source, TrimWindow trim, StageContext context) {
    List<String> command = baseCommand();
    command.add("--get-url");
    command.add(source.locator());

    ExternalProcessChannel channel =
        channels
            .newChannel(DOWNLOADER, command)
            .fatalPatterns(fatalPatterns)
            .cancellationToken(context.token())
            .stdout(StdoutMode.CAPTURE)
            .start();
    channel.await();

    String url =
        channel.capturedOutput().stream()
            .map(String::trim)
            .filter(line -> line.startsWith("http://") || line.startsWith("https://"))
            .findFirst()
            .orElseThrow(() -> new PipelineException("yt-dlp did not print a media URL"));
    LOGGER.info("Resolved direct media URL for {}", source.locator());
    return AcquiredInput.url(url, trim.startSeconds(), trim.durationSeconds());
  }

  /**
   * Download only the trim window. The result is measured and, when it overshoots the requested
   * duration by more than the tolerance, flagged for a secondary trim.
   */
  public AcquiredInput downloadSection(JobSpec job, StageContext context) {
    context.token().throwIfRequested("Section download");
    TrimWindow trim = job.trim();
    Path base = context.tempResources().createTempFile("section-" + job.id());
    String end =
        trim.hasDuration() ? DiagnosticParser.formatSeconds(trim.endSeconds()) : "inf";

    List<String> command = baseCommand();
    command.add("--download-sections");
    command.add("*" + DiagnosticParser.formatSeconds(trim.startSeconds()) + "-" + end);
    command.add("--force-keyframes-at-cuts");
    command.add("--newline");
    command.add("--progress");
    command.add("--print");
    command.add("after_move:filepath");
    command.add("-o");
    command.add(base + ".%(ext)s");
    command.add(job.source().locator());

    ExternalProcessChannel channel =
        channels
            .newChannel(DOWNLOADER, command)
            .fatalPatterns(fatalPatterns)
            .cancellationToken(context.token())
            .stdout(StdoutMode.CAPTURE)
            .listener(acquisitionProgress(context))
            .start();
    Path file;
    try {
      channel.await();
      file = locateDownload(channel.capturedOutput(), base);
    } finally {
      trackLeftovers(base, context);
    }

    double actual = mediaProbe.durationSeconds(file, context.token());
    Double requested = trim.durationSeconds();
    boolean secondaryTrim = requested != null && actual - requested > durationToleranceSeconds;
    if (secondaryTrim) {
      LOGGER.info(
          "Section download overshot: actual={}s, requested={}s; trimming to {}s",
          actual,
          requested,
          requested);
    }
    context.progress().report(Phase.ACQUISITION, 100);
    return AcquiredInput.file(
        AcquisitionPolicy.SECTION_DOWNLOAD,
        file,
        0,
        secondaryTrim ? requested : null,
        secondaryTrim);
  }

  /** Start streaming the whole source to stdout. The transcode stage consumes the pipe. */
  AcquiredInput streamFullSource(AudioSource source, StageContext context) {
    List<String> command = baseCommand();
    command.add("-N");
    command.add(String.valueOf(connections));
    command.add("--newline");
    command.add("-o");
    command.add("-");
    command.add(source.locator());

    ExternalProcessChannel channel =
        channels
            .newChannel(DOWNLOADER, command)
            .fatalPatterns(fatalPatterns)
            .cancellationToken(context.token())
            .stdout(StdoutMode.PIPE)
            .listener(acquisitionProgress(context))
            .start();
    channel.closeStdin();
    return AcquiredInput.pipe(channel, 0, null);
  }

  private List<String> baseCommand() {
    List<String> command = new ArrayList<>();
    command.add(ytdlp);
    command.add("-f");
    command.add("bestaudio");
    command.add("--no-playlist");
    command.addAll(cookies.arguments());
    return command;
  }

  private static DiagnosticListener acquisitionProgress(StageContext context) {
    return new DiagnosticListener() {
      @Override
      public void onPercent(double percent) {
        context.progress().report(Phase.ACQUISITION, percent);
      }
    };
  }

  /** The downloader prints the final path; fall back to scanning for the template's base name. */
  private static Path locateDownload(List<String> output, Path base) {
    String prefix = base.toString();
    for (int i = output.size() - 1; i >= 0; i--) {
      String line = output.get(i).trim();
      if (line.startsWith(prefix) && Files.isRegularFile(Paths.get(line))) {
        return Paths.get(line);
      }
    }
    return findByPrefix(base).stream()
        .filter(path -> !path.getFileName().toString().endsWith(".part"))
        .findFirst()
        .orElseThrow(() -> new PipelineException("yt-dlp finished without producing a file"));
  }

  /** Register everything the downloader wrote under the base name, partial files included. */
  private static void trackLeftovers(Path base, StageContext context) {
    for (Path path : findByPrefix(base)) {
      context.tempResources().track(path);
    }
  }

  private static List<Path> findByPrefix(Path base) {
    Path dir = base.getParent();
    String name = base.getFileName().toString();
    if (dir == null || !Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      List<Path> matches = new ArrayList<>();
      files.filter(path -> path.getFileName().toString().startsWith(name)).forEach(matches::add);
      return matches;
    } catch (IOException e) {
      LOGGER.warn("Could not list scratch directory {}: {}", dir, e.getMessage());
      return List.of();
    }
  }
}
