package com.scholary.audio.pipeline.stage;

/** How the input for the transcoder was obtained. */
public enum AcquisitionPolicy {
  /** yt-dlp resolved a direct media URL; the transcoder seeks into it over HTTP. */
  DIRECT_URL,
  /** yt-dlp downloaded only the requested section to a scratch file. */
  SECTION_DOWNLOAD,
  /** yt-dlp streams the whole source into the transcoder's stdin. */
  PASS_THROUGH,
  /** The object was copied from object storage to a scratch file. */
  STORED_OBJECT
}
