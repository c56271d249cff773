package com.scholary.audio.pipeline.progress;

import com.scholary.audio.pipeline.job.TrimWindow;
import com.scholary.audio.pipeline.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds per-phase progress into one monotonically non-decreasing integer per job.
 *
 * <p>Each phase owns a range of the 0..100 scale. Acquisition and transcoding share 0..98; merging
 * owns 98..100. How the first 98 points are split depends on the trim window: without trimming the
 * download is a 2 point sliver, with trimming the acquisition band grows with the share of the
 * source that has to be fetched before the window starts, scaled down by how much faster fetching
 * runs than transcoding.
 *
 * <p>A value is written to the sink only if it is strictly greater than everything written
 * before. When bounds move mid-job the value already written becomes the floor of the active phase,
 * so a recomputation can never make the bar jump backwards.
 *
 * <p>One instance per job; all methods are synchronized because diagnostic readers of different
 * processes may report concurrently.
 */
public class ProgressAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressAggregator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final double MIN_ACQUISITION_END = 2;
  static final double TRANSCODE_END = 98;
  static final double MERGE_END = 100;

  private final ProgressSink sink;
  private final String locator;
  private final double acquisitionSpeedRatio;

  private ProgressRange acquisition = new ProgressRange(0, MIN_ACQUISITION_END);
  private ProgressRange transcode = new ProgressRange(MIN_ACQUISITION_END, TRANSCODE_END);
  private ProgressRange merge = new ProgressRange(TRANSCODE_END, MERGE_END);
  private Phase active = Phase.ACQUISITION;
  private TrimWindow trim = TrimWindow.none();
  private int maxEmitted = -1;

  public ProgressAggregator(ProgressSink sink, String locator, double acquisitionSpeedRatio) {
    if (acquisitionSpeedRatio <= 0) {
      throw new IllegalArgumentException("acquisitionSpeedRatio must be > 0");
    }
    this.sink = sink;
    this.locator = locator;
    this.acquisitionSpeedRatio = acquisitionSpeedRatio;
  }

  /** End of the acquisition band for a trim window, clamped to [2, 98]. */
  public static double acquisitionBandEnd(TrimWindow trim, double acquisitionSpeedRatio) {
    if (!trim.isTrimming() || !trim.hasDuration()) {
      return MIN_ACQUISITION_END;
    }
    double start = trim.startSeconds();
    double share = start / (start + trim.durationSeconds());
    double end = Math.round(share / acquisitionSpeedRatio * TRANSCODE_END);
    return clamp(end, MIN_ACQUISITION_END, TRANSCODE_END);
  }

  /** Size the acquisition and transcode bands for the job's trim window. */
  public synchronized void plan(TrimWindow window) {
    this.trim = window;
    recomputeBoundaries(acquisitionBandEnd(window, acquisitionSpeedRatio));
    LOGGER.debug("Progress bands planned: acquisition={}, transcode={}", acquisition, transcode);
  }

  /**
   * The transcoder reported the source length. For a window with a start but no duration this is
   * the first moment the acquisition share is known.
   */
  public synchronized void onSourceDurationKnown(double totalSeconds) {
    if (!trim.isTrimming() || trim.hasDuration()) {
      return;
    }
    double remaining = totalSeconds - trim.startSeconds();
    if (remaining <= 0) {
      return;
    }
    TrimWindow resolved = TrimWindow.of(trim.startSeconds(), remaining);
    recomputeBoundaries(acquisitionBandEnd(resolved, acquisitionSpeedRatio));
  }

  /**
   * Move the acquisition/transcode boundary. Bounds never decrease and never drop below what has
   * already been written.
   */
  public synchronized void recomputeBoundaries(double newAcquisitionEnd) {
    double floor = Math.max(0, maxEmitted);
    if (active == Phase.ACQUISITION) {
      double end =
          clamp(
              Math.max(Math.max(acquisition.end(), newAcquisitionEnd), floor),
              MIN_ACQUISITION_END,
              TRANSCODE_END);
      acquisition = acquisition.withEnd(end);
      transcode = new ProgressRange(end, TRANSCODE_END);
    } else if (active == Phase.TRANSCODE) {
      double start =
          Math.min(TRANSCODE_END, Math.max(Math.max(transcode.start(), newAcquisitionEnd), floor));
      transcode = transcode.withStart(start);
    }
  }

  /** Activate a phase. Phases only move forward; the new phase starts at or above the floor. */
  public synchronized void beginPhase(Phase phase) {
    if (phase.ordinal() < active.ordinal()) {
      LOGGER.debug("Ignoring request to move progress back from {} to {}", active, phase);
      return;
    }
    active = phase;
    double floor = Math.max(0, maxEmitted);
    if (phase == Phase.TRANSCODE) {
      transcode = transcode.withStart(Math.max(transcode.start(), floor));
    } else if (phase == Phase.MERGE) {
      merge = merge.withStart(Math.max(merge.start(), floor));
    }
  }

  /** Report phase-local progress (0..100). Reports for an inactive phase are dropped. */
  public synchronized void report(Phase phase, double localPercent) {
    if (phase != active) {
      LOGGER.debug("Dropping {} progress while {} is active", phase, active);
      return;
    }
    if (Double.isNaN(localPercent) || Double.isInfinite(localPercent)) {
      return;
    }
    int value = (int) Math.round(rangeOf(phase).map(localPercent));
    emit(value, phase.name());
  }

  /** Write the final 100. */
  public synchronized void complete() {
    emit((int) MERGE_END, "COMPLETE");
  }

  /** Remove the sink entry. Called once the job ends, whatever the outcome. */
  public void remove() {
    try {
      sink.remove(locator);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to remove progress entry {}: {}", locator, e.getMessage());
    }
  }

  public synchronized int maxEmitted() {
    return maxEmitted;
  }

  public synchronized Phase activePhase() {
    return active;
  }

  public synchronized ProgressRange rangeOf(Phase phase) {
    switch (phase) {
      case ACQUISITION:
        return acquisition;
      case TRANSCODE:
        return transcode;
      case MERGE:
        return merge;
      default:
        throw new IllegalStateException("Unknown phase: " + phase);
    }
  }

  private void emit(int value, String phaseName) {
    if (value <= maxEmitted) {
      LOGGER.debug("Skipping progress {} (already at {})", value, maxEmitted);
      return;
    }
    maxEmitted = value;
    STRUCTURED_LOGGER.logProgress(locator, value, phaseName);
    try {
      sink.set(locator, value);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to write progress {} for {}: {}", value, locator, e.getMessage());
    }
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
