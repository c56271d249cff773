package com.scholary.audio.pipeline.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TempResourceRegistryTest {

  @TempDir Path tempDir;

  @Test
  void createTempFile_shouldReserveUniqueSanitizedPathInsideScratchDir() {
    TempResourceRegistry registry = new TempResourceRegistry(tempDir.resolve("scratch"));

    Path first = registry.createTempFile("raw-abc/../x y");
    Path second = registry.createTempFile("raw-abc/../x y");

    assertThat(first).isNotEqualTo(second);
    assertThat(first.getParent()).isEqualTo(tempDir.resolve("scratch"));
    assertThat(first.getFileName().toString()).endsWith("raw-abc_.._x_y");
    assertThat(Files.isDirectory(tempDir.resolve("scratch"))).isTrue();
    assertThat(Files.exists(first)).isFalse();
    assertThat(registry.size()).isEqualTo(2);
  }

  @Test
  void releaseAll_shouldDeleteEveryTrackedFile() throws Exception {
    TempResourceRegistry registry = new TempResourceRegistry(tempDir);
    Path reserved = registry.createTempFile("processed");
    Files.writeString(reserved, "audio");
    Path external = registry.track(Files.writeString(tempDir.resolve("section.m4a"), "audio"));
    registry.createTempFile("never-written");

    registry.releaseAll();

    assertThat(registry.isEmpty()).isTrue();
    assertThat(Files.exists(reserved)).isFalse();
    assertThat(Files.exists(external)).isFalse();
  }

  @Test
  void release_shouldIgnoreUntrackedPaths() throws Exception {
    TempResourceRegistry registry = new TempResourceRegistry(tempDir);
    Path untracked = Files.writeString(tempDir.resolve("keep.mp3"), "audio");

    registry.release(untracked);
    registry.release(null);

    assertThat(Files.exists(untracked)).isTrue();
  }
}
