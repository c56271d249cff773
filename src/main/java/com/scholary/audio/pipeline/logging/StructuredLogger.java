package com.scholary.audio.pipeline.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Pipeline events carry their fields in MDC so they can be filtered in the log backend
 * (event_type=process_exited, phase=transcode, ...). Job-level fields are set once per job with
 * {@link #setJobContext(JobContext)}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a subprocess launch. */
  public void logProcessStarted(String tool, List<String> command) {
    try {
      MDC.put("event_type", "process_started");
      MDC.put("tool", tool);

      logger.info("Process started: tool={}, command={}", tool, String.join(" ", command));
    } finally {
      clearEventFields();
    }
  }

  /** Log a subprocess exit. Non-zero exits are logged at warn. */
  public void logProcessExited(String tool, int exitCode, long elapsedMs) {
    try {
      MDC.put("event_type", "process_exited");
      MDC.put("tool", tool);
      MDC.put("exitCode", String.valueOf(exitCode));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      String format = "Process exited: tool={}, exitCode={}, elapsed={}ms";
      if (exitCode == 0) {
        logger.info(format, tool, exitCode, elapsedMs);
      } else {
        logger.warn(format, tool, exitCode, elapsedMs);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a stage starting. */
  public void logPhaseStarted(String phase, String detail) {
    try {
      MDC.put("event_type", "phase_started");
      MDC.put("phase", phase);

      logger.info("Phase started: phase={}, {}", phase, detail);
    } finally {
      clearEventFields();
    }
  }

  /** Log a stage finishing. */
  public void logPhaseFinished(String phase, long elapsedMs) {
    try {
      MDC.put("event_type", "phase_finished");
      MDC.put("phase", phase);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Phase finished: phase={}, elapsed={}ms", phase, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log an emitted progress value. */
  public void logProgress(String locator, int percent, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("percent", String.valueOf(percent));
      MDC.put("phase", phase);

      logger.debug("Progress: locator={}, phase={}, progress={}%", locator, phase, percent);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job status transition written to the document store. */
  public void logStatusChange(String jobId, String status, String message) {
    try {
      MDC.put("event_type", "status_change");
      MDC.put("status", status);

      logger.info("Status change: jobId={}, status={}, message={}", jobId, status, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a switch from one acquisition policy to another. */
  public void logFallback(String from, String to, String reason) {
    try {
      MDC.put("event_type", "acquisition_fallback");
      MDC.put("phase", "acquisition");

      logger.warn("Acquisition fallback: from={}, to={}, reason={}", from, to, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log the terminal failure of a job. */
  public void logJobFailed(String jobId, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorType", errorType);

      logger.error("Job failed: jobId={}, error={}, message={}", jobId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(JobContext context) {
    MDC.put("jobId", context.jobId());
    MDC.put("requestId", context.requestId());
    MDC.put("operation", context.operation());
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("requestId");
    MDC.remove("operation");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("tool");
    MDC.remove("exitCode");
    MDC.remove("elapsedMs");
    MDC.remove("phase");
    MDC.remove("percent");
    MDC.remove("status");
    MDC.remove("errorType");
  }
}
