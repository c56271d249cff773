package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.job.PipelineException;

/** A subprocess printed a line matching one of its fatal patterns. */
public class FatalDiagnosticException extends PipelineException {

  private final String pattern;

  public FatalDiagnosticException(String tool, String pattern, String line) {
    super(String.format("%s reported a fatal error (%s): %s", tool, pattern, line));
    this.pattern = pattern;
  }

  public String pattern() {
    return pattern;
  }
}
