package com.scholary.audio.pipeline.stage;

/**
 * A published transcoder output.
 *
 * @param outputDurationSeconds last output position the transcoder reported, null if it reported
 *     none
 */
public record TranscodeResult(String key, Double outputDurationSeconds) {}
