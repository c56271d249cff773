package com.scholary.audio.pipeline.objectstore;

import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * An upload whose content is written as a stream of unknown length.
 *
 * <p>Closing the stream commits the object; {@link #completion()} completes once the store has
 * acknowledged it. A producer that exits cleanly therefore does not mean the object exists: callers
 * close the stream and then wait for the completion separately.
 */
public interface ObjectUpload {

  OutputStream outputStream();

  CompletableFuture<Void> completion();

  /** Discard everything written so far; nothing is published. No-op once completed. */
  void abort(Throwable cause);
}
