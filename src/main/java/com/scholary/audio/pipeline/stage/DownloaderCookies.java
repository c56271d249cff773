package com.scholary.audio.pipeline.stage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audio.pipeline.config.PipelineProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps yt-dlp's cookie file in sync with the shared copy and builds the {@code --cookies}
 * argument.
 *
 * <p>The shared copy is re-read at most every few minutes. If it cannot be read the file already
 * on disk keeps being used. {@code --cookies} is only passed when the file exists.
 */
@Component
public class DownloaderCookies {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloaderCookies.class);

  private static final Duration REFRESH_INTERVAL = Duration.ofMinutes(10);
  private static final String CACHE_KEY = "cookies";

  private final Path cookiesFile;
  private final CookieSource source;
  private final Cache<String, Boolean> refreshed =
      Caffeine.newBuilder().expireAfterWrite(REFRESH_INTERVAL).build();

  @Autowired
  public DownloaderCookies(PipelineProperties properties, Optional<CookieSource> source) {
    this(blankToNull(properties.tools().cookiesFile()), source.orElse(CookieSource.NONE));
  }

  DownloaderCookies(String cookiesFile, CookieSource source) {
    this.cookiesFile = cookiesFile == null ? null : Paths.get(cookiesFile);
    this.source = source;
  }

  /** {@code ["--cookies", <file>]} when a cookie file is available, otherwise empty. */
  public List<String> arguments() {
    if (cookiesFile == null) {
      return List.of();
    }
    refreshed.get(CACHE_KEY, key -> refresh());
    return Files.isRegularFile(cookiesFile)
        ? List.of("--cookies", cookiesFile.toString())
        : List.of();
  }

  private synchronized Boolean refresh() {
    Optional<String> encoded;
    try {
      encoded = source.encodedCookies();
    } catch (RuntimeException e) {
      LOGGER.warn("Could not read shared downloader cookies: {}", e.getMessage());
      return Boolean.FALSE;
    }
    if (encoded.isEmpty()) {
      return Boolean.FALSE;
    }
    try {
      byte[] decoded = Base64.getMimeDecoder().decode(encoded.get());
      Path parent = cookiesFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(cookiesFile, decoded);
      LOGGER.info("Downloader cookie file refreshed: {}", cookiesFile);
      return Boolean.TRUE;
    } catch (IllegalArgumentException | IOException e) {
      LOGGER.warn("Could not write downloader cookie file {}: {}", cookiesFile, e.getMessage());
      return Boolean.FALSE;
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
