package com.scholary.audio.pipeline.job;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks every scratch file one job creates so they can all be removed when the job ends.
 *
 * <p>Paths are handed out before anything is written to them. Each path is released at most once:
 * removal from the registry happens before the file is deleted, so concurrent callers of {@link
 * #release(Path)} and {@link #releaseAll()} never delete the same entry twice. Release failures are
 * logged and never escalated.
 */
public class TempResourceRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(TempResourceRegistry.class);

  private final Path scratchDir;
  private final Set<Path> paths = ConcurrentHashMap.newKeySet();

  public TempResourceRegistry(Path scratchDir) {
    this.scratchDir = scratchDir;
  }

  /**
   * Reserve a unique scratch path. The file itself is not created.
   *
   * @param nameHint readable suffix for the file name; unsafe characters are replaced
   */
  public Path createTempFile(String nameHint) {
    try {
      Files.createDirectories(scratchDir);
    } catch (IOException e) {
      throw new PipelineException("Failed to create scratch directory: " + scratchDir, e);
    }
    Path path = scratchDir.resolve(UUID.randomUUID() + "-" + sanitize(nameHint));
    paths.add(path);
    LOGGER.debug("Reserved scratch file: {}", path);
    return path;
  }

  /** Register a path created by someone else, e.g. a downloader that picked its own extension. */
  public Path track(Path path) {
    paths.add(path);
    return path;
  }

  public void release(Path path) {
    if (path == null || !paths.remove(path)) {
      return;
    }
    try {
      if (Files.deleteIfExists(path)) {
        LOGGER.debug("Deleted scratch file: {}", path);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete scratch file {}: {}", path, e.getMessage());
    }
  }

  public void releaseAll() {
    List<Path> snapshot = new ArrayList<>(paths);
    for (Path path : snapshot) {
      release(path);
    }
  }

  public boolean isEmpty() {
    return paths.isEmpty();
  }

  public int size() {
    return paths.size();
  }

  public boolean isTracked(Path path) {
    return paths.contains(path);
  }

  public Path scratchDir() {
    return scratchDir;
  }

  private static String sanitize(String hint) {
    if (hint == null || hint.isBlank()) {
      return "tmp";
    }
    return hint.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
