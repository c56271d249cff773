package com.scholary.audio.pipeline.stage;

import com.scholary.audio.pipeline.process.ExternalProcessChannel;
import java.nio.file.Path;

/**
 * What the transcoder reads from, plus the trimming it still has to apply.
 *
 * @param location file path or URL; {@code pipe:0} for pipes
 * @param seekSeconds start offset the transcoder applies, 0 when the input is already cut
 * @param durationLimitSeconds duration the transcoder applies, null for "until the end"
 * @param secondaryTrim whether the duration limit corrects an overlong section download
 * @param tempFile scratch file holding the input, null if none
 * @param downloader process feeding a pipe input, null otherwise
 */
public record AcquiredInput(
    InputKind kind,
    String location,
    AcquisitionPolicy policy,
    double seekSeconds,
    Double durationLimitSeconds,
    boolean secondaryTrim,
    Path tempFile,
    ExternalProcessChannel downloader) {

  public enum InputKind {
    FILE,
    URL,
    PIPE
  }

  public static AcquiredInput file(
      AcquisitionPolicy policy,
      Path file,
      double seekSeconds,
      Double durationLimitSeconds,
      boolean secondaryTrim) {
    return new AcquiredInput(
        InputKind.FILE,
        file.toString(),
        policy,
        seekSeconds,
        durationLimitSeconds,
        secondaryTrim,
        file,
        null);
  }

  public static AcquiredInput url(String url, double seekSeconds, Double durationLimitSeconds) {
    return new AcquiredInput(
        InputKind.URL,
        url,
        AcquisitionPolicy.DIRECT_URL,
        seekSeconds,
        durationLimitSeconds,
        false,
        null,
        null);
  }

  public static AcquiredInput pipe(
      ExternalProcessChannel downloader, double seekSeconds, Double durationLimitSeconds) {
    return new AcquiredInput(
        InputKind.PIPE,
        "pipe:0",
        AcquisitionPolicy.PASS_THROUGH,
        seekSeconds,
        durationLimitSeconds,
        false,
        null,
        downloader);
  }

  public boolean isPipe() {
    return kind == InputKind.PIPE;
  }
}
