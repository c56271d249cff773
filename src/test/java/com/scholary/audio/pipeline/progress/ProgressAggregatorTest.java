package com.scholary.audio.pipeline.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.scholary.audio.pipeline.job.TrimWindow;
import com.scholary.audio.pipeline.support.RecordingProgressSink;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressAggregatorTest {

  private final RecordingProgressSink sink = new RecordingProgressSink();
  private final ProgressAggregator aggregator = new ProgressAggregator(sink, "sermon-1", 5.0);

  @Test
  void acquisitionBandEnd_shouldGrowWithShareBeforeWindow() {
    assertThat(ProgressAggregator.acquisitionBandEnd(TrimWindow.of(40, 20.0), 5.0))
        .isEqualTo(13.0);
    assertThat(ProgressAggregator.acquisitionBandEnd(TrimWindow.none(), 5.0)).isEqualTo(2.0);
    assertThat(ProgressAggregator.acquisitionBandEnd(TrimWindow.of(1, 3600.0), 5.0))
        .isEqualTo(2.0);
    assertThat(ProgressAggregator.acquisitionBandEnd(TrimWindow.of(3600, 1.0), 0.5))
        .isEqualTo(98.0);
  }

  @Test
  void untrimmedJob_shouldUseSliverAcquisitionBandAndEndAtHundred() {
    aggregator.plan(TrimWindow.none());

    assertThat(aggregator.rangeOf(Phase.ACQUISITION)).isEqualTo(new ProgressRange(0, 2));
    aggregator.report(Phase.ACQUISITION, 0);
    aggregator.report(Phase.ACQUISITION, 100);
    aggregator.beginPhase(Phase.TRANSCODE);
    aggregator.report(Phase.TRANSCODE, 0);
    aggregator.report(Phase.TRANSCODE, 50);
    aggregator.report(Phase.TRANSCODE, 100);
    aggregator.complete();

    assertThat(sink.values()).containsExactly(0, 2, 50, 98, 100);
  }

  @Test
  void trimmedJob_shouldStartTranscodeAtAcquisitionEnd() {
    aggregator.plan(TrimWindow.of(40, 20.0));

    assertThat(aggregator.rangeOf(Phase.ACQUISITION).end()).isEqualTo(13.0);
    aggregator.report(Phase.ACQUISITION, 100);
    aggregator.beginPhase(Phase.TRANSCODE);
    aggregator.report(Phase.TRANSCODE, 0);
    aggregator.report(Phase.TRANSCODE, 10);

    assertThat(aggregator.rangeOf(Phase.TRANSCODE).start()).isEqualTo(13.0);
    assertThat(sink.values()).containsExactly(13, 22);
  }

  @Test
  void report_shouldNeverWriteBackwardOrEqualValues() {
    aggregator.plan(TrimWindow.none());
    aggregator.beginPhase(Phase.TRANSCODE);

    aggregator.report(Phase.TRANSCODE, 50);
    aggregator.report(Phase.TRANSCODE, 40);
    aggregator.report(Phase.TRANSCODE, 50);
    aggregator.report(Phase.TRANSCODE, Double.NaN);
    aggregator.report(Phase.TRANSCODE, 60);

    assertThat(sink.values()).containsExactly(50, 60);
    assertThat(aggregator.maxEmitted()).isEqualTo(60);
  }

  @Test
  void report_shouldDropProgressOfInactivePhase() {
    aggregator.plan(TrimWindow.none());
    aggregator.beginPhase(Phase.TRANSCODE);

    aggregator.report(Phase.ACQUISITION, 100);
    aggregator.beginPhase(Phase.ACQUISITION);

    assertThat(sink.values()).isEmpty();
    assertThat(aggregator.activePhase()).isEqualTo(Phase.TRANSCODE);
  }

  @Test
  void onSourceDurationKnown_shouldResizeOpenEndedWindow() {
    aggregator.plan(TrimWindow.of(30, null));
    assertThat(aggregator.rangeOf(Phase.ACQUISITION).end()).isEqualTo(2.0);

    aggregator.onSourceDurationKnown(150);

    assertThat(aggregator.rangeOf(Phase.ACQUISITION).end()).isEqualTo(4.0);
    assertThat(aggregator.rangeOf(Phase.TRANSCODE).start()).isEqualTo(4.0);
  }

  @Test
  void recomputeBoundaries_shouldFloorTranscodeStartAtEmittedValue() {
    aggregator.plan(TrimWindow.of(40, 20.0));
    aggregator.report(Phase.ACQUISITION, 100);
    aggregator.beginPhase(Phase.TRANSCODE);
    aggregator.report(Phase.TRANSCODE, 50);

    aggregator.recomputeBoundaries(2);

    assertThat(aggregator.rangeOf(Phase.TRANSCODE).start()).isGreaterThanOrEqualTo(13.0);
    aggregator.report(Phase.TRANSCODE, 0);
    assertThat(sink.values()).isSortedAccordingTo(Integer::compare).doesNotHaveDuplicates();
  }

  @Test
  void merge_shouldMapIntoLastTwoPoints() {
    aggregator.plan(TrimWindow.none());
    aggregator.beginPhase(Phase.TRANSCODE);
    aggregator.report(Phase.TRANSCODE, 100);
    aggregator.beginPhase(Phase.MERGE);
    aggregator.report(Phase.MERGE, 50);
    aggregator.complete();

    assertThat(sink.values()).containsExactly(98, 99, 100);
  }

  @Test
  void sinkFailures_shouldNotPropagate() {
    ProgressSink failing =
        new ProgressSink() {
          @Override
          public void set(String locator, int percent) {
            throw new IllegalStateException("database offline");
          }

          @Override
          public void remove(String locator) {
            throw new IllegalStateException("database offline");
          }
        };
    ProgressAggregator failingAggregator = new ProgressAggregator(failing, "sermon-1", 5.0);

    assertThatCode(
            () -> {
              failingAggregator.report(Phase.ACQUISITION, 100);
              failingAggregator.complete();
              failingAggregator.remove();
            })
        .doesNotThrowAnyException();
    assertThat(failingAggregator.maxEmitted()).isEqualTo(100);
  }

  @Test
  void remove_shouldTearDownSinkEntry() {
    aggregator.remove();

    assertThat(sink.removed()).isEqualTo(List.of("sermon-1"));
  }
}
