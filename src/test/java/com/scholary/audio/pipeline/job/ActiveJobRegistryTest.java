package com.scholary.audio.pipeline.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ActiveJobRegistryTest {

  private final ActiveJobRegistry registry = new ActiveJobRegistry(Duration.ofMinutes(5));

  @Test
  void register_shouldRejectSecondJobWithSameId() {
    registry.register("sermon-1");

    assertThatThrownBy(() -> registry.register("sermon-1"))
        .isInstanceOf(JobAlreadyRunningException.class)
        .hasMessageContaining("sermon-1");
    assertThat(registry.isActive("sermon-1")).isTrue();
  }

  @Test
  void unregister_shouldOnlyRemoveMatchingToken() {
    CancellationToken token = registry.register("sermon-1");

    registry.unregister("sermon-1", new CancellationToken());
    assertThat(registry.isActive("sermon-1")).isTrue();

    registry.unregister("sermon-1", token);
    assertThat(registry.isActive("sermon-1")).isFalse();
    assertThat(registry.register("sermon-1")).isNotSameAs(token);
  }

  @Test
  void cancel_shouldFlipTokenOfRunningJob() {
    CancellationToken token = registry.register("sermon-1");

    assertThat(registry.cancel("sermon-1", "Cancelled by request")).isTrue();
    assertThat(registry.cancel("unknown", "Cancelled by request")).isFalse();

    assertThat(token.isRequested()).isTrue();
    assertThat(registry.find("sermon-1")).containsSame(token);
  }
}
