package com.scholary.audio.pipeline.service;

/**
 * Outcome of a successful job.
 *
 * @param outputKey object key of the published audio, the merged one when clips were added
 * @param durationSeconds total playable length written to the job document
 */
public record PipelineResult(String jobId, String outputKey, double durationSeconds) {}
