package com.scholary.audio.pipeline.job;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Where a job's audio comes from: a remote media URL fetched with yt-dlp, or a key in the object
 * store.
 */
public record AudioSource(Kind kind, String locator) {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSource.class);

  public enum Kind {
    REMOTE_URL,
    STORED_OBJECT
  }

  public AudioSource {
    Objects.requireNonNull(kind, "kind");
    if (locator == null || locator.isBlank()) {
      throw new IllegalArgumentException("Audio source locator must not be blank");
    }
  }

  /**
   * Remote media URL. A {@code t} query parameter is dropped so the start offset always comes from
   * the trim window and never from the link itself.
   */
  public static AudioSource remoteUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Audio source locator must not be blank");
    }
    return new AudioSource(Kind.REMOTE_URL, stripStartOffset(url.trim()));
  }

  public static AudioSource storedObject(String key) {
    return new AudioSource(Kind.STORED_OBJECT, key);
  }

  public boolean isRemote() {
    return kind == Kind.REMOTE_URL;
  }

  static String stripStartOffset(String url) {
    try {
      return UriComponentsBuilder.fromUriString(url).replaceQueryParam("t").build().toUriString();
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Could not parse source URL, using it unchanged: {} ({})", url, e.getMessage());
      return url;
    }
  }
}
