package com.scholary.audio.pipeline.process;

/** Lifecycle of an {@link ExternalProcessChannel}. Exactly one terminal state is ever reached. */
public enum ChannelState {
  STARTING,
  RUNNING,
  SUCCEEDED,
  FAILED,
  SPAWN_ERROR;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == SPAWN_ERROR;
  }
}
