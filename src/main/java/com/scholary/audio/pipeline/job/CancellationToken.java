package com.scholary.audio.pipeline.job;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation flag shared by everything working on one job.
 *
 * <p>Once requested it stays requested. Stages poll it at every boundary and process channels poll
 * it on every diagnostic line. Channels also register a callback so a process that prints nothing
 * is still terminated as soon as the token flips.
 */
public class CancellationToken {

  private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

  private final AtomicReference<String> reason = new AtomicReference<>();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /**
   * Request cancellation. Only the first reason is kept and callbacks run once, on the calling
   * thread.
   *
   * @return true if this call flipped the token
   */
  public boolean requestCancellation(String why) {
    boolean first = reason.compareAndSet(null, why == null ? "cancelled" : why);
    if (first) {
      LOGGER.info("Cancellation requested: {}", reason.get());
      for (Runnable callback : callbacks) {
        runCallback(callback);
      }
    }
    return first;
  }

  public boolean isRequested() {
    return reason.get() != null;
  }

  public String reason() {
    return reason.get();
  }

  /**
   * Fail fast if cancellation was requested.
   *
   * @param operation what was about to happen, used in the exception message
   * @throws CancelledException if the token is set
   */
  public void throwIfRequested(String operation) {
    String why = reason.get();
    if (why != null) {
      throw new CancelledException(operation + " cancelled: " + why);
    }
  }

  /**
   * Run the callback when cancellation is requested, or right away if it already was.
   *
   * @return handle that removes the callback again
   */
  public Runnable onCancel(Runnable callback) {
    callbacks.add(callback);
    if (isRequested() && callbacks.remove(callback)) {
      runCallback(callback);
    }
    return () -> callbacks.remove(callback);
  }

  private static void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOGGER.warn("Cancellation callback failed: {}", e.getMessage(), e);
    }
  }
}
