package com.scholary.audio.pipeline.process;

import java.io.IOException;
import java.util.List;

/** Starts an OS process from an explicit argument vector. No shell is involved. */
@FunctionalInterface
public interface ProcessLauncher {

  Process launch(List<String> command) throws IOException;

  static ProcessLauncher system() {
    return command -> new ProcessBuilder(command).start();
  }
}
