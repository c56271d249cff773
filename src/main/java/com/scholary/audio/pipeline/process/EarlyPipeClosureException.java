package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.job.PipelineException;

/**
 * One end of a pipe closed while the other was still copying.
 *
 * <p>Benign when the consumer already finished its work successfully (ffmpeg stops reading once it
 * has the requested duration), fatal otherwise.
 */
public class EarlyPipeClosureException extends PipelineException {

  public EarlyPipeClosureException(String message) {
    super(message);
  }

  public EarlyPipeClosureException(String message, Throwable cause) {
    super(message, cause);
  }
}
