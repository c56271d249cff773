package com.scholary.audio.pipeline.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.audio.pipeline.job.AudioSource;
import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.job.TrimWindow;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * One processing request. Exactly one of {@code youtubeUrl} and {@code storageFilePath} names the
 * source.
 */
public record ProcessAudioData(
    @NotBlank String id,
    @NotNull @PositiveOrZero Double startTime,
    @Positive Double duration,
    @Schema(description = "Remote media page to download from") String youtubeUrl,
    @Schema(description = "Object key of an already uploaded recording") String storageFilePath,
    String introUrl,
    String outroUrl,
    Boolean deleteOriginal,
    Boolean skipTranscode) {

  @JsonIgnore
  @AssertTrue(message = "exactly one of youtubeUrl and storageFilePath must be set")
  public boolean isSingleSource() {
    return isPresent(youtubeUrl) != isPresent(storageFilePath);
  }

  @JsonIgnore
  @AssertTrue(message = "introUrl and outroUrl must not be blank when present")
  public boolean isClipUrlsValid() {
    return (introUrl == null || !introUrl.isBlank()) && (outroUrl == null || !outroUrl.isBlank());
  }

  @JsonIgnore
  @AssertTrue(message = "startTime and duration must be finite")
  public boolean isFinite() {
    return (startTime == null || Double.isFinite(startTime))
        && (duration == null || Double.isFinite(duration));
  }

  public JobSpec toJobSpec() {
    AudioSource source =
        isPresent(youtubeUrl)
            ? AudioSource.remoteUrl(youtubeUrl.trim())
            : AudioSource.storedObject(storageFilePath.trim());
    return new JobSpec(
        id,
        source,
        TrimWindow.of(startTime, duration),
        Boolean.TRUE.equals(skipTranscode),
        Boolean.TRUE.equals(deleteOriginal),
        introUrl,
        outroUrl);
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }
}
