package com.scholary.audio.pipeline.process;

import com.scholary.audio.pipeline.config.PipelineProperties;
import java.util.List;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Hands out channel builders wired to the shared launcher, I/O executor and tail size. */
@Component
public class ProcessChannelFactory {

  private final ProcessLauncher launcher;
  private final Executor ioExecutor;
  private final int tailLines;

  @Autowired
  public ProcessChannelFactory(
      ProcessLauncher launcher,
      @Qualifier("pipelineIoExecutor") Executor ioExecutor,
      PipelineProperties properties) {
    this(launcher, ioExecutor, properties.job().diagnosticTailLines());
  }

  public ProcessChannelFactory(ProcessLauncher launcher, Executor ioExecutor, int tailLines) {
    this.launcher = launcher;
    this.ioExecutor = ioExecutor;
    this.tailLines = tailLines;
  }

  public ExternalProcessChannel.Builder newChannel(String tool, List<String> command) {
    return ExternalProcessChannel.builder(tool, command)
        .launcher(launcher)
        .executor(ioExecutor)
        .tailLimit(tailLines);
  }

  public Executor ioExecutor() {
    return ioExecutor;
  }
}
