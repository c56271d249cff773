package com.scholary.audio.pipeline.progress;

/** A slice of the global progress scale owned by one phase. */
public record ProgressRange(double start, double end) {

  public ProgressRange {
    if (start < 0 || end > 100 || start > end) {
      throw new IllegalArgumentException(
          String.format("Invalid progress range [%s, %s]", start, end));
    }
  }

  /** Map a phase-local percentage (0..100, clamped) onto this range. */
  public double map(double localPercent) {
    double clamped = Math.max(0, Math.min(100, localPercent));
    return start + (end - start) * clamped / 100.0;
  }

  public ProgressRange withStart(double newStart) {
    return new ProgressRange(Math.min(newStart, end), end);
  }

  public ProgressRange withEnd(double newEnd) {
    return new ProgressRange(start, newEnd);
  }
}
