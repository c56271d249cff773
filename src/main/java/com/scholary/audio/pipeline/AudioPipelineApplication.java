package com.scholary.audio.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the audio pipeline service.
 *
 * <p>Trims and transcodes sermon audio from a media URL or from object storage, optionally wraps it
 * with an intro and outro, publishes the result and reports status and live progress to the
 * database.
 */
@SpringBootApplication
public class AudioPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioPipelineApplication.class, args);
  }
}
