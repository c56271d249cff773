package com.scholary.audio.pipeline.objectstore;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class OutputMetadataTest {

  @Test
  void contentDisposition_shouldUseTitleAsFileName() {
    assertThat(new OutputMetadata(null, " Sunday Service ", null, null).contentDisposition())
        .isEqualTo("inline; filename=\"Sunday Service.mp3\"");
  }

  @Test
  void contentDisposition_shouldFallBackWithoutTitle() {
    assertThat(new OutputMetadata(null, null, null, null).contentDisposition())
        .isEqualTo("inline; filename=\"untitled.mp3\"");
  }

  @Test
  void contentDisposition_shouldEncodeNonAsciiTitle() {
    assertThat(new OutputMetadata(null, "Pâques", null, null).contentDisposition())
        .startsWith("inline; filename*=UTF-8''")
        .contains("P%C3%A2ques.mp3");
  }

  @Test
  void userMetadata_shouldSkipAbsentValuesAndKeepHeadersSafe() {
    OutputMetadata metadata =
        new OutputMetadata(61.5, "Pâques", null, "https://cdn.example/outro.mp3");

    assertThat(metadata.userMetadata())
        .containsExactly(
            Map.entry("duration", "61.5"),
            Map.entry("title", "P%C3%A2ques"),
            Map.entry("outrourl", "https://cdn.example/outro.mp3"));
  }

  @Test
  void withDuration_shouldKeepOtherFields() {
    OutputMetadata metadata = new OutputMetadata(30.0, "Title", "i", "o").withDuration(40.0);

    assertThat(metadata).isEqualTo(new OutputMetadata(40.0, "Title", "i", "o"));
  }
}
