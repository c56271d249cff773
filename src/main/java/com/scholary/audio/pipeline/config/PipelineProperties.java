package com.scholary.audio.pipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the audio pipeline.
 *
 * <p>Maps the "pipeline.*" keys in application.yml: tool locations, the transcoder's audio
 * settings, acquisition tuning, progress banding and per-job limits.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Valid @NotNull Tools tools,
    @Valid @NotNull Transcode transcode,
    @Valid @NotNull Acquisition acquisition,
    @Valid @NotNull Progress progress,
    @Valid @NotNull Job job) {

  /** External binaries. The cookies file is passed to yt-dlp only when it exists on disk. */
  public record Tools(
      @NotBlank String ffmpeg,
      @NotBlank String ffprobe,
      @NotBlank String ytdlp,
      String cookiesFile) {}

  public record Transcode(
      @NotBlank String audioCodec,
      @NotBlank String bitrate,
      @Positive int sampleRate,
      @Positive int channels,
      @NotBlank String filterChain,
      List<String> fatalPatterns) {

    public Transcode {
      fatalPatterns = fatalPatterns == null ? List.of() : List.copyOf(fatalPatterns);
    }
  }

  public record Acquisition(
      @PositiveOrZero double durationToleranceSeconds,
      @Positive int connections,
      List<String> downloaderFatalPatterns) {

    public Acquisition {
      downloaderFatalPatterns =
          downloaderFatalPatterns == null ? List.of() : List.copyOf(downloaderFatalPatterns);
    }
  }

  /**
   * Progress banding.
   *
   * @param acquisitionSpeedRatio how many times faster acquisition runs than transcoding, used to
   *     size the acquisition band for trimmed remote sources
   */
  public record Progress(@Positive double acquisitionSpeedRatio) {}

  public record Job(
      @NotBlank String tempDir,
      @Positive long timeoutSeconds,
      @PositiveOrZero long timeoutMarginSeconds,
      @Positive int existenceRetries,
      @PositiveOrZero long existenceRetryDelayMillis,
      @NotBlank String processedPrefix,
      @NotBlank String mergedPrefix,
      @Positive int executorThreads,
      @PositiveOrZero int executorQueueSize,
      @Positive int ioThreads,
      @Positive int diagnosticTailLines) {

    /** Wall-clock budget after which a running job is cancelled. */
    public long effectiveTimeoutSeconds() {
      return Math.max(1, timeoutSeconds - timeoutMarginSeconds);
    }
  }
}
