package com.scholary.audio.pipeline.progress;

/** Pipeline phases that own a slice of the 0..100 progress scale, in execution order. */
public enum Phase {
  ACQUISITION,
  TRANSCODE,
  MERGE
}
