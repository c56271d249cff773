package com.scholary.audio.pipeline.job;

import java.util.Objects;

/** Everything one processing request asks for. */
public record JobSpec(
    String id,
    AudioSource source,
    TrimWindow trim,
    boolean skipTranscode,
    boolean deleteOriginal,
    String introUrl,
    String outroUrl) {

  public JobSpec {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Job id must not be blank");
    }
    Objects.requireNonNull(source, "source");
    trim = trim == null ? TrimWindow.none() : trim;
    introUrl = blankToNull(introUrl);
    outroUrl = blankToNull(outroUrl);
  }

  public boolean hasIntro() {
    return introUrl != null;
  }

  public boolean hasOutro() {
    return outroUrl != null;
  }

  public boolean hasAuxiliaryClips() {
    return hasIntro() || hasOutro();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
