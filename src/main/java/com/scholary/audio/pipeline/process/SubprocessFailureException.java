package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.job.PipelineException;
import java.util.List;

/** A subprocess exited with a non-zero code. */
public class SubprocessFailureException extends PipelineException {

  private final String tool;
  private final int exitCode;
  private final Integer signal;

  public SubprocessFailureException(String tool, int exitCode, List<String> diagnosticTail) {
    super(buildMessage(tool, exitCode, signalOf(exitCode), diagnosticTail));
    this.tool = tool;
    this.exitCode = exitCode;
    this.signal = signalOf(exitCode);
  }

  public String tool() {
    return tool;
  }

  public int exitCode() {
    return exitCode;
  }

  /** Signal number for exit codes above 128, otherwise null. */
  public Integer signal() {
    return signal;
  }

  static Integer signalOf(int exitCode) {
    return exitCode > 128 ? exitCode - 128 : null;
  }

  private static String buildMessage(
      String tool, int exitCode, Integer signal, List<String> diagnosticTail) {
    StringBuilder message = new StringBuilder();
    message.append(tool).append(" exited with code ").append(exitCode);
    if (signal != null) {
      message.append(" (signal ").append(signal).append(')');
    }
    if (diagnosticTail != null && !diagnosticTail.isEmpty()) {
      message.append(": ").append(String.join("\n", diagnosticTail));
    }
    return message.toString();
  }
}
