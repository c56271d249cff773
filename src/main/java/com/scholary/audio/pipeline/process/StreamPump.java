package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.job.PipelineException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies one stream into another on a pool thread.
 *
 * <p>The returned future completes with the byte count, or fails with {@link
 * EarlyPipeClosureException} when the failure looks like the other side hung up, or with a plain
 * {@link PipelineException} for anything else. Whether an early closure matters is the caller's
 * decision. When the pump closes its output, a failed copy is visible on the future before the
 * output is closed, so a consumer that exits on end of input never looks like a clean finish.
 */
public final class StreamPump {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamPump.class);

  private static final int BUFFER_SIZE = 64 * 1024;
  private static final String[] EARLY_CLOSURE_MARKERS = {
    "Broken pipe", "Stream closed", "Pipe closed", "EPIPE"
  };

  private StreamPump() {}

  /**
   * Start copying.
   *
   * @param name label for logs and error messages, e.g. "yt-dlp->ffmpeg"
   * @param closeOutput whether to close the output once the input is exhausted
   */
  public static CompletableFuture<Long> start(
      String name, InputStream in, OutputStream out, boolean closeOutput, Executor executor) {
    CompletableFuture<Long> result = new CompletableFuture<>();
    executor.execute(() -> copy(name, in, out, closeOutput, result));
    return result;
  }

  public static boolean isEarlyPipeClosure(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      String message = t.getMessage();
      if (message == null) {
        continue;
      }
      for (String marker : EARLY_CLOSURE_MARKERS) {
        if (message.contains(marker)) {
          return true;
        }
      }
    }
    return false;
  }

  private static void copy(
      String name,
      InputStream in,
      OutputStream out,
      boolean closeOutput,
      CompletableFuture<Long> result) {
    long copied = 0;
    PipelineException failure = null;
    byte[] buffer = new byte[BUFFER_SIZE];
    try {
      int read;
      while ((read = in.read(buffer)) != -1) {
        out.write(buffer, 0, read);
        copied += read;
      }
      out.flush();
    } catch (IOException e) {
      failure = classify(name, e);
    } catch (RuntimeException e) {
      failure = new PipelineException("Stream copy failed: " + name + ": " + e.getMessage(), e);
    }

    // A failure is published before the consumer can see end of input.
    if (failure != null) {
      LOGGER.debug("Pump {} stopped after {} bytes: {}", name, copied, failure.getMessage());
      result.completeExceptionally(failure);
    }

    if (closeOutput) {
      try {
        out.close();
      } catch (IOException e) {
        if (failure == null) {
          failure = classify(name, e);
          LOGGER.debug("Pump {} failed on close: {}", name, failure.getMessage());
          result.completeExceptionally(failure);
        } else {
          LOGGER.debug("Closing {} after failure also failed: {}", name, e.getMessage());
        }
      }
    }

    if (failure == null) {
      LOGGER.debug("Pump {} finished: {} bytes", name, copied);
      result.complete(copied);
    }
  }

  private static PipelineException classify(String name, IOException e) {
    if (isEarlyPipeClosure(e)) {
      return new EarlyPipeClosureException("Pipe closed early: " + name + ": " + e.getMessage(), e);
    }
    return new PipelineException("Stream copy failed: " + name + ": " + e.getMessage(), e);
  }
}
