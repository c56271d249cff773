package com.scholary.audio.pipeline.api;

import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.service.PipelineResult;
import com.scholary.audio.pipeline.service.ProcessAudioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for audio processing.
 *
 * <p>Processing is synchronous: the request returns once the audio is published and the job
 * document is marked processed, or with an error status once it is marked failed.
 */
@RestController
@Tag(name = "Process Audio", description = "Trim, transcode and publish sermon audio")
public class ProcessAudioController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessAudioController.class);

  static final String VERSION = "1.1.0";
  static final String BANNER =
      "Process Audio Running version "
          + VERSION
          + "\nPost to /process-audio with data in the format of\n"
          + "{\n"
          + "  id (string),\n"
          + "  startTime (number),\n"
          + "  duration (number),\n"
          + "  youtubeUrl (string) || storageFilePath (string),\n"
          + "  introUrl (string),\n"
          + "  outroUrl (string)\n"
          + "}\n";

  private final ProcessAudioService processAudioService;

  public ProcessAudioController(ProcessAudioService processAudioService) {
    this.processAudioService = processAudioService;
  }

  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(summary = "Service banner", description = "Version and expected request format")
  public String banner() {
    return BANNER;
  }

  @PostMapping("/process-audio")
  @Operation(
      summary = "Process audio",
      description =
          "Trim and transcode a remote or stored recording, optionally add an intro and outro, "
              + "and publish it. Status and progress are written to the realtime database.")
  public ResponseEntity<ProcessAudioResponse> processAudio(
      @Valid @RequestBody ProcessAudioRequest request) {
    JobSpec job = request.data().toJobSpec();
    LOGGER.info(
        "Process audio request: id={}, source={}, start={}, duration={}",
        job.id(),
        job.source().locator(),
        job.trim().startSeconds(),
        job.trim().durationSeconds());
    PipelineResult result = processAudioService.process(job);
    return ResponseEntity.ok(ProcessAudioResponse.from(result));
  }

  @PostMapping("/process-audio/{id}/cancel")
  @Operation(summary = "Cancel a job", description = "Request cancellation of a running job")
  public ResponseEntity<Void> cancel(@PathVariable String id) {
    if (processAudioService.cancel(id)) {
      return ResponseEntity.accepted().build();
    }
    return ResponseEntity.notFound().build();
  }
}
