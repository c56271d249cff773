package com.scholary.audio.pipeline.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TrimWindowTest {

  @Test
  void none_shouldNotTrim() {
    TrimWindow window = TrimWindow.none();

    assertThat(window.isTrimming()).isFalse();
    assertThat(window.hasDuration()).isFalse();
    assertThat(window.endSeconds()).isNull();
  }

  @Test
  void of_shouldTrimWhenStartOrDurationIsSet() {
    assertThat(TrimWindow.of(40, 20.0).isTrimming()).isTrue();
    assertThat(TrimWindow.of(40, 20.0).endSeconds()).isEqualTo(60.0);
    assertThat(TrimWindow.of(40, null).isTrimming()).isTrue();
    assertThat(TrimWindow.of(0, 30.0).isTrimming()).isTrue();
  }

  @Test
  void constructor_shouldRejectNegativeOrNonFiniteValues() {
    assertThatThrownBy(() -> TrimWindow.of(-1, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TrimWindow.of(Double.NaN, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TrimWindow.of(0, 0.0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TrimWindow.of(0, Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
