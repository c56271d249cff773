package com.scholary.audio.pipeline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audio.pipeline.config.PipelineProperties;
import com.scholary.audio.pipeline.document.DocumentNotFoundException;
import com.scholary.audio.pipeline.document.DocumentStoreException;
import com.scholary.audio.pipeline.document.JobStatus;
import com.scholary.audio.pipeline.document.StatusUpdate;
import com.scholary.audio.pipeline.job.AudioSource;
import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.JobSpec;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.job.TrimWindow;
import com.scholary.audio.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.audio.pipeline.process.ProcessChannelFactory;
import com.scholary.audio.pipeline.stage.AcquisitionStage;
import com.scholary.audio.pipeline.stage.ClipFetcher;
import com.scholary.audio.pipeline.stage.DownloaderCookies;
import com.scholary.audio.pipeline.stage.MediaProbe;
import com.scholary.audio.pipeline.stage.MergeStage;
import com.scholary.audio.pipeline.stage.TranscodeStage;
import com.scholary.audio.pipeline.support.InMemoryDocumentStore;
import com.scholary.audio.pipeline.support.InMemoryObjectStore;
import com.scholary.audio.pipeline.support.RecordingProgressSink;
import com.scholary.audio.pipeline.support.ScriptedProcessLauncher;
import com.scholary.audio.pipeline.support.TestProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs whole jobs against scripted tools and in-memory stores. */
class PipelineOrchestratorTest {

  private static final String ID = "sermon-1";
  private static final String ORIGINAL_KEY = "uploads/sermon-1.mp3";
  private static final String PROCESSED_KEY = "processed-sermons/sermon-1";
  private static final String MERGED_KEY = "intro-outro-sermons/sermon-1";
  private static final String VIDEO_URL = "https://www.youtube.com/watch?v=abc123";
  private static final String MEDIA_URL = "https://media.example/a.m4a";

  private static final String TRANSCODER_SCRIPT =
      "echo '  Duration: 00:01:00.00, start: 0.000000' >&2;"
          + " echo 'size=   1kB time=00:00:15.00 bitrate=128.0kbits/s' >&2;"
          + " printf 'mp3-bytes';"
          + " echo 'size=   2kB time=00:00:30.00 bitrate=128.0kbits/s' >&2";

  @TempDir Path tempDir;

  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final ScriptedProcessLauncher launcher = new ScriptedProcessLauncher();
  private final InMemoryObjectStore objectStore = new InMemoryObjectStore();
  private final InMemoryDocumentStore documents = new InMemoryDocumentStore();
  private final RecordingProgressSink sink = new RecordingProgressSink();
  private final ClipFetcher clipFetcher = mock(ClipFetcher.class);
  private final CancellationToken token = new CancellationToken();

  private PipelineOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    PipelineProperties properties = TestProperties.pipeline(tempDir);
    ObjectStoreProperties storeProperties = TestProperties.objectStore();
    ProcessChannelFactory channels = new ProcessChannelFactory(launcher, executor, 20);
    MediaProbe probe = new MediaProbe(channels, new ObjectMapper(), properties);
    orchestrator =
        new PipelineOrchestrator(
            new AcquisitionStage(
                channels,
                objectStore,
                probe,
                new DownloaderCookies(properties, Optional.empty()),
                storeProperties,
                properties),
            new TranscodeStage(channels, objectStore, storeProperties, properties),
            new MergeStage(channels, objectStore, storeProperties, properties),
            probe,
            clipFetcher,
            documents,
            sink,
            objectStore,
            executor,
            storeProperties,
            properties);
    documents.create(ID, "Sunday Service");
    objectStore.put(ORIGINAL_KEY, "raw audio");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static JobSpec storedJob(
      TrimWindow trim, boolean deleteOriginal, String intro, String outro) {
    return new JobSpec(
        ID, AudioSource.storedObject(ORIGINAL_KEY), trim, false, deleteOriginal, intro, outro);
  }

  private void assertScratchEmpty() throws Exception {
    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  private void clip(String url, String content) {
    when(clipFetcher.fetch(eq(url), any(Path.class), any(CancellationToken.class)))
        .thenAnswer(
            invocation -> {
              Path target = invocation.getArgument(1);
              Files.writeString(target, content);
              return target;
            });
  }

  @Test
  void run_shouldTrimStoredObjectAndMarkProcessed() throws Exception {
    launcher.when("ffmpeg", TRANSCODER_SCRIPT);

    PipelineResult result =
        orchestrator.run(storedJob(TrimWindow.of(10, 30.0), false, null, null), token);

    assertThat(result).isEqualTo(new PipelineResult(ID, PROCESSED_KEY, 30.0));
    assertThat(objectStore.content(PROCESSED_KEY)).isEqualTo("mp3-bytes");
    assertThat(objectStore.metadata(PROCESSED_KEY).title()).isEqualTo("Sunday Service");
    assertThat(objectStore.contains(ORIGINAL_KEY)).isTrue();
    assertThat(launcher.launched("ffmpeg")).hasSize(1);
    assertThat(launcher.launched("ffmpeg").get(0)).containsSubsequence("-ss", "10", "-i");

    assertThat(documents.status(ID)).isEqualTo(JobStatus.PROCESSED.name());
    assertThat(documents.field(ID, StatusUpdate.DURATION_SECONDS)).isEqualTo(30.0);
    assertThat(documents.field(ID, StatusUpdate.MESSAGE)).isNull();
    assertThat(documents.messages())
        .containsExactly(
            PipelineOrchestrator.GETTING_DATA,
            PipelineOrchestrator.TRIMMING_AND_TRANSCODING,
            PipelineOrchestrator.TRIMMING_AND_TRANSCODING,
            null);

    assertThat(sink.values()).isSorted().doesNotHaveDuplicates().endsWith(98, 100);
    assertThat(sink.removed()).containsExactly(ID);
    assertScratchEmpty();
    verifyNoInteractions(clipFetcher);
  }

  @Test
  void run_shouldDeleteOriginalWhenRequested() {
    launcher.when("ffmpeg", TRANSCODER_SCRIPT);

    orchestrator.run(storedJob(TrimWindow.of(10, 30.0), true, null, null), token);

    assertThat(objectStore.contains(ORIGINAL_KEY)).isFalse();
    assertThat(objectStore.contains(PROCESSED_KEY)).isTrue();
  }

  @Test
  void run_shouldUseTranscoderDurationWithoutRequestedDuration() {
    launcher.when("ffmpeg", TRANSCODER_SCRIPT);

    PipelineResult result =
        orchestrator.run(storedJob(TrimWindow.none(), false, null, null), token);

    assertThat(result.durationSeconds()).isEqualTo(30.0);
    assertThat(launcher.launched("ffprobe")).isEmpty();
  }

  @Test
  void run_shouldMergeIntroAndOutro() throws Exception {
    launcher
        .when("ffmpeg", "concat", ScriptedProcessLauncher.CONCAT_LIST_FILES)
        .when("ffmpeg", TRANSCODER_SCRIPT)
        .when("ffprobe", "echo '{\"format\":{\"duration\":\"5.0\"}}'");
    clip("https://cdn.example/intro.mp3", "intro|");
    clip("https://cdn.example/outro.mp3", "|outro");

    PipelineResult result =
        orchestrator.run(
            storedJob(
                TrimWindow.of(10, 30.0),
                false,
                "https://cdn.example/intro.mp3",
                "https://cdn.example/outro.mp3"),
            token);

    assertThat(result).isEqualTo(new PipelineResult(ID, MERGED_KEY, 40.0));
    assertThat(objectStore.content(MERGED_KEY)).isEqualTo("intro|mp3-bytes|outro");
    assertThat(objectStore.metadata(MERGED_KEY).durationSeconds()).isEqualTo(40.0);
    assertThat(objectStore.metadata(MERGED_KEY).introUrl())
        .isEqualTo("https://cdn.example/intro.mp3");
    assertThat(objectStore.contains(PROCESSED_KEY)).isTrue();
    assertThat(documents.messages()).contains(PipelineOrchestrator.ADDING_CLIPS);
    assertThat(documents.field(ID, StatusUpdate.DURATION_SECONDS)).isEqualTo(40.0);
    assertThat(sink.last()).isEqualTo(100);
    assertScratchEmpty();
  }

  @Test
  void run_shouldFailJobWhenClipCannotBeFetched() throws Exception {
    launcher.when("ffmpeg", TRANSCODER_SCRIPT);
    when(clipFetcher.fetch(any(), any(), any()))
        .thenThrow(new PipelineException("Clip URL returned 404"));

    assertThatThrownBy(
            () ->
                orchestrator.run(
                    storedJob(TrimWindow.of(10, 30.0), false, "https://cdn.example/i.mp3", null),
                    token))
        .hasMessageContaining("404");

    assertThat(documents.status(ID)).isEqualTo(JobStatus.ERROR.name());
    assertThat(objectStore.contains(MERGED_KEY)).isFalse();
    assertScratchEmpty();
  }

  @Test
  void run_shouldFallBackToSectionDownloadWhenDirectUrlFails() throws Exception {
    launcher
        .when("yt-dlp", "--get-url", "echo " + MEDIA_URL)
        .when(
            "yt-dlp",
            "--download-sections",
            ScriptedProcessLauncher.OUTPUT_TEMPLATE_TO_FILE
                + " printf 'section' > \"$f\"; echo \"$f\"")
        .when("ffprobe", "echo '{\"format\":{\"duration\":\"20.4\"}}'")
        .when(
            command -> command.get(0).equals("ffmpeg") && command.contains(MEDIA_URL),
            "echo 'HTTP error 403 Forbidden' >&2; exit 1")
        .when("ffmpeg", TRANSCODER_SCRIPT);
    JobSpec job =
        new JobSpec(
            ID, AudioSource.remoteUrl(VIDEO_URL), TrimWindow.of(40, 20.0), false, false, null,
            null);

    PipelineResult result = orchestrator.run(job, token);

    assertThat(result).isEqualTo(new PipelineResult(ID, PROCESSED_KEY, 20.0));
    List<List<String>> transcodes = launcher.launched("ffmpeg");
    assertThat(transcodes).hasSize(2);
    assertThat(transcodes.get(1)).doesNotContain("-ss", "-t", MEDIA_URL);
    assertThat(documents.messages())
        .startsWith(PipelineOrchestrator.GETTING_DATA, PipelineOrchestrator.DOWNLOADING);
    assertThat(documents.status(ID)).isEqualTo(JobStatus.PROCESSED.name());
    assertThat(sink.values()).isSorted().doesNotHaveDuplicates();
    assertScratchEmpty();
  }

  @Test
  void run_shouldMarkErrorAndCleanUpWhenCancelled() throws Exception {
    launcher.when("ffmpeg", "sleep 10");
    CompletableFuture.runAsync(
        () -> token.requestCancellation("Cancelled by request"),
        CompletableFuture.delayedExecutor(300, TimeUnit.MILLISECONDS));

    assertThatThrownBy(
            () -> orchestrator.run(storedJob(TrimWindow.of(10, 30.0), false, null, null), token))
        .isInstanceOf(CancelledException.class);

    assertThat(documents.status(ID)).isEqualTo(JobStatus.ERROR.name());
    assertThat((String) documents.field(ID, StatusUpdate.MESSAGE))
        .contains("Cancelled by request");
    assertThat(objectStore.contains(PROCESSED_KEY)).isFalse();
    assertThat(sink.removed()).containsExactly(ID);
    assertScratchEmpty();
  }

  @Test
  void run_shouldNotWriteStatusForMissingDocument() {
    JobSpec job =
        new JobSpec(
            "missing", AudioSource.storedObject(ORIGINAL_KEY), null, false, false, null, null);

    assertThatThrownBy(() -> orchestrator.run(job, token))
        .isInstanceOf(DocumentNotFoundException.class)
        .hasMessageContaining("after 3 attempts");

    assertThat(documents.updates()).isEmpty();
    assertThat(launcher.launched()).isEmpty();
  }

  @Test
  void run_shouldKeepOriginalFailureWhenErrorStatusCannotBeWritten() {
    documents.failUpdates();

    Throwable thrown =
        catchThrowable(
            () -> orchestrator.run(storedJob(TrimWindow.none(), false, null, null), token));

    assertThat(thrown).isInstanceOf(DocumentStoreException.class);
    assertThat(thrown.getSuppressed()).hasSize(1);
    assertThat(launcher.launched()).isEmpty();
  }
}
