package com.scholary.audio.pipeline.stage;

import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.objectstore.ObjectUpload;
import com.scholary.audio.pipeline.objectstore.UploadFailureException;
import com.scholary.audio.pipeline.process.ExternalProcessChannel;
import com.scholary.audio.pipeline.process.Futures;
import com.scholary.audio.pipeline.process.StreamPump;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Feeds a process's stdout into an object upload and settles both.
 *
 * <p>The upload is committed only after the process exited with 0 and every byte was copied; in
 * every other case it is aborted. When both sides failed, the upload's error is reported, since a
 * failing store is usually what made the producer die.
 */
final class UploadPipe {

  private UploadPipe() {}

  static void run(ExternalProcessChannel producer, ObjectUpload upload, Executor executor) {
    run(producer, upload, executor, () -> {});
  }

  /**
   * @param beforeCommit last check before the object is published; throwing a {@link
   *     PipelineException} aborts the upload instead
   */
  static void run(
      ExternalProcessChannel producer,
      ObjectUpload upload,
      Executor executor,
      Runnable beforeCommit) {
    CompletableFuture<Long> pump =
        StreamPump.start(
            producer.tool() + "->upload",
            producer.stdout(),
            upload.outputStream(),
            false,
            executor);
    // A producer writing into a dead pipe would block forever.
    pump.whenComplete(
        (copied, error) -> {
          if (error != null) {
            producer.terminate();
          }
        });

    try {
      producer.await();
      Futures.join(pump);
      beforeCommit.run();
    } catch (PipelineException e) {
      throw abort(upload, e);
    }

    try {
      upload.outputStream().close();
    } catch (IOException e) {
      PipelineException failure = Futures.failureOf(upload.completion());
      throw failure != null ? failure : new UploadFailureException("Upload failed on close", e);
    }
    Futures.join(upload.completion());
  }

  private static PipelineException abort(ObjectUpload upload, PipelineException cause) {
    PipelineException uploadFailure = Futures.failureOf(upload.completion());
    upload.abort(cause);
    if (cause instanceof CancelledException || uploadFailure == null) {
      return cause;
    }
    uploadFailure.addSuppressed(cause);
    return uploadFailure;
  }
}
