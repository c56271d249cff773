package com.scholary.audio.pipeline.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audio.pipeline.job.PipelineException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StreamPumpTest {

  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void start_shouldCopyEverythingAndCloseOutputWhenAsked() {
    byte[] data = "mp3 frames".getBytes(StandardCharsets.UTF_8);
    AtomicBoolean closed = new AtomicBoolean();
    ByteArrayOutputStream out =
        new ByteArrayOutputStream() {
          @Override
          public void close() {
            closed.set(true);
          }
        };

    long copied =
        Futures.join(
            StreamPump.start("test", new ByteArrayInputStream(data), out, true, executor));

    assertThat(copied).isEqualTo(data.length);
    assertThat(out.toByteArray()).isEqualTo(data);
    assertThat(closed).isTrue();
  }

  @Test
  void start_shouldClassifyBrokenPipeAsEarlyClosure() {
    OutputStream broken =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
          }
        };

    assertThatThrownBy(
            () ->
                Futures.join(
                    StreamPump.start(
                        "yt-dlp->ffmpeg",
                        new ByteArrayInputStream(new byte[16]),
                        broken,
                        false,
                        executor)))
        .isInstanceOf(EarlyPipeClosureException.class)
        .hasMessageContaining("yt-dlp->ffmpeg");
  }

  @Test
  void start_shouldReportOtherFailuresAsPipelineException() {
    OutputStream full =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            throw new IOException("No space left on device");
          }
        };

    assertThatThrownBy(
            () ->
                Futures.join(
                    StreamPump.start(
                        "ffmpeg->upload", new ByteArrayInputStream(new byte[16]), full, false,
                        executor)))
        .isInstanceOf(PipelineException.class)
        .isNotInstanceOf(EarlyPipeClosureException.class)
        .hasMessageContaining("No space left");
  }

  @Test
  void start_shouldFailFutureBeforeClosingOutputOnReadError() {
    InputStream failing =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("Input/output error");
          }
        };
    AtomicReference<CompletableFuture<Long>> pump = new AtomicReference<>();
    AtomicBoolean failedWhenClosed = new AtomicBoolean();
    OutputStream consumer =
        new ByteArrayOutputStream() {
          @Override
          public void close() {
            failedWhenClosed.set(pump.get().isCompletedExceptionally());
          }
        };
    List<Runnable> tasks = new ArrayList<>();

    pump.set(StreamPump.start("yt-dlp->ffmpeg", failing, consumer, true, tasks::add));
    tasks.forEach(Runnable::run);

    assertThat(failedWhenClosed).isTrue();
    assertThatThrownBy(() -> Futures.join(pump.get()))
        .isInstanceOf(PipelineException.class)
        .isNotInstanceOf(EarlyPipeClosureException.class)
        .hasMessageContaining("Input/output error");
  }

  @Test
  void isEarlyPipeClosure_shouldLookThroughCauses() {
    Exception wrapped = new RuntimeException("copy failed", new IOException("Stream closed"));

    assertThat(StreamPump.isEarlyPipeClosure(wrapped)).isTrue();
    assertThat(StreamPump.isEarlyPipeClosure(new IOException("timeout"))).isFalse();
  }
}
