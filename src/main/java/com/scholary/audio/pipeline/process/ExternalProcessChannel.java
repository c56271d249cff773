package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.PipelineException;
import com.scholary.audio.pipeline.logging.StructuredLogger;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One running external process together with its diagnostic stream.
 *
 * <p>The channel owns the child's stderr: a reader on the I/O executor splits it into lines (ffmpeg
 * separates progress updates with {@code \r}, which {@link BufferedReader#readLine()} accepts) and
 * turns each line into listener events. On every line the cancellation token and the fatal
 * patterns are checked; either one terminates the process and fails the channel at once, without
 * waiting for the exit.
 *
 * <p>The outcome is exposed as {@link #completion()}. The channel moves STARTING to RUNNING to
 * exactly one terminal state, so a process killed after a fatal line still reports the fatal line
 * and not its exit code.
 */
public final class ExternalProcessChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExternalProcessChannel.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final long KILL_GRACE_SECONDS = 5;
  private static final int MAX_CAPTURED_LINES = 2000;

  private final String tool;
  private final List<String> command;
  private final List<String> fatalPatterns;
  private final DiagnosticListener listener;
  private final CancellationToken token;
  private final StdoutMode stdoutMode;
  private final int tailLimit;
  private final Executor executor;

  private final AtomicReference<ChannelState> state = new AtomicReference<>(ChannelState.STARTING);
  private final CompletableFuture<Integer> completion = new CompletableFuture<>();
  private final Deque<String> tail = new ArrayDeque<>();
  private final List<String> captured = new ArrayList<>();

  private volatile Process process;
  private boolean totalDurationSeen;
  private long startedAtNanos;
  private volatile Runnable cancelRegistration = () -> {};

  private ExternalProcessChannel(Builder builder) {
    this.tool = builder.tool;
    this.command = List.copyOf(builder.command);
    this.fatalPatterns = List.copyOf(builder.fatalPatterns);
    this.listener = builder.listener;
    this.token = builder.token;
    this.stdoutMode = builder.stdoutMode;
    this.tailLimit = builder.tailLimit;
    this.executor = builder.executor;
  }

  public static Builder builder(String tool, List<String> command) {
    return new Builder(tool, command);
  }

  private void start(ProcessLauncher launcher) {
    if (token != null) {
      token.throwIfRequested(tool);
    }
    STRUCTURED_LOGGER.logProcessStarted(tool, command);
    try {
      process = launcher.launch(command);
    } catch (IOException | RuntimeException e) {
      state.set(ChannelState.SPAWN_ERROR);
      SpawnFailureException failure =
          new SpawnFailureException("Failed to start " + tool + ": " + e.getMessage(), e);
      completion.completeExceptionally(failure);
      throw failure;
    }
    startedAtNanos = System.nanoTime();
    state.set(ChannelState.RUNNING);
    if (token != null) {
      cancelRegistration =
          token.onCancel(
              () ->
                  failAndTerminate(
                      new CancelledException(tool + " cancelled: " + token.reason())));
    }

    try {
      CompletableFuture<Void> stderrDone = readAsync(process.getErrorStream(), true);
      CompletableFuture<Void> stdoutDone = CompletableFuture.completedFuture(null);
      if (stdoutMode == StdoutMode.CAPTURE) {
        closeStdin();
        stdoutDone = readAsync(process.getInputStream(), false);
      }
      CompletableFuture.allOf(stderrDone, stdoutDone)
          .thenCompose(ignored -> process.onExit())
          .whenComplete((exited, error) -> settle(error));
    } catch (RejectedExecutionException e) {
      PipelineException failure =
          new PipelineException("No I/O thread available for " + tool, e);
      failAndTerminate(failure);
      throw failure;
    }
  }

  /** Child's stdin. Only meaningful when the caller feeds the process. */
  public OutputStream stdin() {
    return process.getOutputStream();
  }

  /** Child's stdout. Only meaningful in {@link StdoutMode#PIPE}. */
  public InputStream stdout() {
    return process.getInputStream();
  }

  /** Close stdin so the child sees end of input. */
  public void closeStdin() {
    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      LOGGER.debug("Closing stdin of {} failed: {}", tool, e.getMessage());
    }
  }

  /** Completes with 0 on success; fails with the first failure the channel saw. */
  public CompletableFuture<Integer> completion() {
    return completion;
  }

  /** Block until the channel reaches a terminal state; rethrows its failure. */
  public int await() {
    return Futures.join(completion);
  }

  public ChannelState state() {
    return state.get();
  }

  public String tool() {
    return tool;
  }

  public boolean isAlive() {
    Process current = process;
    return current != null && current.isAlive();
  }

  public synchronized List<String> diagnosticTail() {
    return new ArrayList<>(tail);
  }

  /** Stdout lines collected in {@link StdoutMode#CAPTURE}. */
  public synchronized List<String> capturedOutput() {
    return new ArrayList<>(captured);
  }

  /**
   * Ask the process and its children to stop, then force-kill whatever is still alive after a
   * grace period. Does not change the channel state by itself.
   */
  public void terminate() {
    Process current = process;
    if (current == null || !current.isAlive()) {
      return;
    }
    LOGGER.info("Terminating {} (pid {})", tool, current.pid());
    current.descendants().forEach(ProcessHandle::destroy);
    current.destroy();
    current
        .onExit()
        .completeOnTimeout(current, KILL_GRACE_SECONDS, TimeUnit.SECONDS)
        .thenAccept(
            p -> {
              if (p.isAlive()) {
                LOGGER.warn("{} ignored termination, killing it", tool);
                p.descendants().forEach(ProcessHandle::destroyForcibly);
                p.destroyForcibly();
              }
            });
  }

  private CompletableFuture<Void> readAsync(InputStream stream, boolean diagnostic) {
    return CompletableFuture.runAsync(() -> readLines(stream, diagnostic), executor);
  }

  private void readLines(InputStream stream, boolean diagnostic) {
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!handleLine(line, diagnostic)) {
          return;
        }
      }
    } catch (IOException e) {
      if (!state.get().isTerminal()) {
        LOGGER.debug("{} output stream ended with error: {}", tool, e.getMessage());
      }
    }
  }

  private synchronized boolean handleLine(String line, boolean diagnostic) {
    if (state.get() != ChannelState.RUNNING) {
      return false;
    }
    if (diagnostic) {
      remember(line);
    } else if (captured.size() < MAX_CAPTURED_LINES) {
      captured.add(line);
    }

    if (token != null && token.isRequested()) {
      failAndTerminate(new CancelledException(tool + " cancelled: " + token.reason()));
      return false;
    }
    if (diagnostic) {
      Optional<String> fatal = DiagnosticParser.matchFatal(line, fatalPatterns);
      if (fatal.isPresent()) {
        failAndTerminate(new FatalDiagnosticException(tool, fatal.get(), line));
        return false;
      }
    }

    try {
      dispatchMarkers(line);
    } catch (RuntimeException e) {
      failAndTerminate(Futures.unwrap(e));
      return false;
    }
    return true;
  }

  private void dispatchMarkers(String line) {
    if (!totalDurationSeen) {
      OptionalLong total = DiagnosticParser.parseTotalDuration(line);
      if (total.isPresent()) {
        totalDurationSeen = true;
        listener.onTotalDuration(total.getAsLong());
        return;
      }
    }
    OptionalLong position = DiagnosticParser.parsePosition(line);
    if (position.isPresent()) {
      listener.onPosition(position.getAsLong());
      return;
    }
    OptionalDouble percent = DiagnosticParser.parseDownloadPercent(line);
    if (percent.isPresent()) {
      listener.onPercent(percent.getAsDouble());
    }
  }

  private void remember(String line) {
    if (tailLimit <= 0) {
      return;
    }
    if (tail.size() == tailLimit) {
      tail.removeFirst();
    }
    tail.addLast(line);
  }

  private void settle(Throwable error) {
    cancelRegistration.run();
    if (error != null) {
      failAndTerminate(Futures.unwrap(error));
      return;
    }
    int exitCode = process.exitValue();
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    STRUCTURED_LOGGER.logProcessExited(tool, exitCode, elapsedMs);
    if (exitCode == 0) {
      if (state.compareAndSet(ChannelState.RUNNING, ChannelState.SUCCEEDED)) {
        completion.complete(0);
      }
    } else {
      fail(new SubprocessFailureException(tool, exitCode, diagnosticTail()));
    }
  }

  private void fail(PipelineException failure) {
    if (state.compareAndSet(ChannelState.RUNNING, ChannelState.FAILED)) {
      LOGGER.warn("{} failed: {}", tool, failure.getMessage());
      completion.completeExceptionally(failure);
    }
  }

  private void failAndTerminate(PipelineException failure) {
    fail(failure);
    terminate();
  }

  /** Configures and starts a channel. */
  public static final class Builder {

    private final String tool;
    private final List<String> command;
    private List<String> fatalPatterns = List.of();
    private DiagnosticListener listener = DiagnosticListener.NONE;
    private CancellationToken token;
    private StdoutMode stdoutMode = StdoutMode.PIPE;
    private int tailLimit = 20;
    private Executor executor;
    private ProcessLauncher launcher = ProcessLauncher.system();

    private Builder(String tool, List<String> command) {
      this.tool = tool;
      this.command = command;
    }

    public Builder fatalPatterns(List<String> patterns) {
      this.fatalPatterns = patterns;
      return this;
    }

    public Builder listener(DiagnosticListener listener) {
      this.listener = listener;
      return this;
    }

    public Builder cancellationToken(CancellationToken token) {
      this.token = token;
      return this;
    }

    public Builder stdout(StdoutMode mode) {
      this.stdoutMode = mode;
      return this;
    }

    public Builder tailLimit(int lines) {
      this.tailLimit = lines;
      return this;
    }

    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    public Builder launcher(ProcessLauncher launcher) {
      this.launcher = launcher;
      return this;
    }

    /**
     * Spawn the process.
     *
     * @throws SpawnFailureException if the process could not be started
     * @throws CancelledException if the token was already set
     */
    public ExternalProcessChannel start() {
      if (executor == null) {
        throw new IllegalStateException("An executor is required to read process output");
      }
      ExternalProcessChannel channel = new ExternalProcessChannel(this);
      channel.start(launcher);
      return channel;
    }
  }
}
