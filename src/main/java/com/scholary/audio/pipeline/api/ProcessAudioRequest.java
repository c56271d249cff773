package com.scholary.audio.pipeline.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/** Request envelope: the job fields are wrapped in a {@code data} object. */
public record ProcessAudioRequest(@Valid @NotNull ProcessAudioData data) {}
