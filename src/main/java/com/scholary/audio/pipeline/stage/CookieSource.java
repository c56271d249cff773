package com.scholary.audio.pipeline.stage;

import java.util.Optional;

/** Supplies the downloader's cookie jar as base64-encoded Netscape cookie file content. */
@FunctionalInterface
public interface CookieSource {

  CookieSource NONE = Optional::empty;

  Optional<String> encodedCookies();
}
