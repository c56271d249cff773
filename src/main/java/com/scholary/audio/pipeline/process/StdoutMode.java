package com.scholary.audio.pipeline.process;

/** What a channel does with the child's standard output. */
public enum StdoutMode {
  /** The caller reads stdout, usually by pumping it somewhere. */
  PIPE,
  /** Stdout lines are collected and also scanned for progress markers. */
  CAPTURE
}
