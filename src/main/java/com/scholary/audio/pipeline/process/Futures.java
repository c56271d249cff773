package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.PipelineException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Joins futures and surfaces their failures as pipeline exceptions instead of wrappers. */
public final class Futures {

  private Futures() {}

  public static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      throw unwrap(e);
    } catch (CancellationException e) {
      throw new CancelledException("Operation was cancelled", e);
    }
  }

  /** Strip completion wrappers; anything that is not a pipeline failure gets wrapped in one. */
  public static PipelineException unwrap(Throwable throwable) {
    Throwable cause = throwable;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof PipelineException) {
      return (PipelineException) cause;
    }
    String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
    return new PipelineException(message, cause);
  }

  /** Failure of an already completed future, or null if it succeeded or is still running. */
  public static PipelineException failureOf(CompletableFuture<?> future) {
    if (!future.isCompletedExceptionally()) {
      return null;
    }
    try {
      future.join();
      return null;
    } catch (CompletionException | CancellationException e) {
      return unwrap(e);
    }
  }
}
