package com.scholary.audio.pipeline.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.process.ExternalProcessChannel;
import com.scholary.audio.pipeline.process.ProcessChannelFactory;
import com.scholary.audio.pipeline.process.StdoutMode;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Measures media duration with ffprobe's JSON output. */
@Component
public class MediaProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaProbe.class);

  private final ProcessChannelFactory channels;
  private final ObjectMapper objectMapper;
  private final String ffprobe;

  @Autowired
  public MediaProbe(
      ProcessChannelFactory channels, ObjectMapper objectMapper, PipelineProperties properties) {
    this(channels, objectMapper, properties.tools().ffprobe());
  }

  MediaProbe(ProcessChannelFactory channels, ObjectMapper objectMapper, String ffprobe) {
    this.channels = channels;
    this.objectMapper = objectMapper;
    this.ffprobe = ffprobe;
  }

  /**
   * Duration of a local media file in seconds.
   *
   * @throws PipelineException if ffprobe fails or reports no duration
   */
  public double durationSeconds(Path file, CancellationToken token) {
    List<String> command =
        List.of(
            ffprobe, "-v", "error", "-show_entries", "format=duration", "-of", "json",
            file.toString());
    ExternalProcessChannel channel =
        channels
            .newChannel("ffprobe", command)
            .cancellationToken(token)
            .stdout(StdoutMode.CAPTURE)
            .start();
    channel.await();

    String json = String.join("\n", channel.capturedOutput());
    double duration = parseDuration(json);
    LOGGER.debug("Probed duration: file={}, duration={}s", file.getFileName(), duration);
    return duration;
  }

  double parseDuration(String json) {
    try {
      JsonNode duration = objectMapper.readTree(json).path("format").path("duration");
      if (duration.isMissingNode() || duration.isNull()) {
        throw new PipelineException("ffprobe reported no duration: " + json);
      }
      double seconds =
          duration.isNumber() ? duration.asDouble() : Double.parseDouble(duration.asText());
      if (Double.isNaN(seconds) || seconds < 0) {
        throw new PipelineException("ffprobe reported an invalid duration: " + duration.asText());
      }
      return seconds;
    } catch (JsonProcessingException | NumberFormatException e) {
      throw new PipelineException("Failed to parse ffprobe output: " + e.getMessage(), e);
    }
  }
}
