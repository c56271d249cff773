package com.scholary.audio.pipeline.process;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the markers ffmpeg and yt-dlp print on their diagnostic streams.
 *
 * <p>Examples of the lines this understands:
 *
 * <pre>
 *   Duration: 00:42:10.53, start: 0.025057, bitrate: 128 kb/s
 *   size=    1024kB time=00:01:05.27 bitrate= 128.5kbits/s speed=42.1x
 *   [download]  37.5% of   48.21MiB at    3.20MiB/s ETA 00:09
 * </pre>
 */
public final class DiagnosticParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticParser.class);

  private static final Pattern POSITION_PATTERN =
      Pattern.compile("time=(\\d{2}:\\d{2}:\\d{2}\\.\\d{2})");
  private static final Pattern DURATION_PATTERN =
      Pattern.compile("Duration:\\s*(\\d{2}:\\d{2}:\\d{2}\\.\\d{2})");
  private static final Pattern PERCENT_PATTERN =
      Pattern.compile("(100(?:\\.0{1,2})?|\\d{1,2}(?:\\.\\d{1,2})?)%");
  private static final Pattern TIMESTAMP_PATTERN =
      Pattern.compile("(\\d+):(\\d{1,2}):(\\d{1,2})(?:\\.(\\d+))?");

  private DiagnosticParser() {}

  public static OptionalLong parsePosition(String line) {
    Matcher matcher = POSITION_PATTERN.matcher(line);
    if (matcher.find()) {
      return OptionalLong.of(convertStringToMilliseconds(matcher.group(1)));
    }
    return OptionalLong.empty();
  }

  public static OptionalLong parseTotalDuration(String line) {
    Matcher matcher = DURATION_PATTERN.matcher(line);
    if (matcher.find()) {
      return OptionalLong.of(convertStringToMilliseconds(matcher.group(1)));
    }
    return OptionalLong.empty();
  }

  /** Percentage from a downloader progress line. Lines not mentioning a download are ignored. */
  public static OptionalDouble parseDownloadPercent(String line) {
    if (!line.toLowerCase(Locale.ROOT).contains("download")) {
      return OptionalDouble.empty();
    }
    Matcher matcher = PERCENT_PATTERN.matcher(line);
    if (matcher.find()) {
      return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
    }
    return OptionalDouble.empty();
  }

  /** First fatal pattern contained in the line, if any. */
  public static Optional<String> matchFatal(String line, List<String> fatalPatterns) {
    for (String pattern : fatalPatterns) {
      if (!pattern.isEmpty() && line.contains(pattern)) {
        return Optional.of(pattern);
      }
    }
    return Optional.empty();
  }

  /**
   * Convert {@code HH:MM:SS.ff} to milliseconds. The fraction is read as a decimal fraction of a
   * second, so two digits are hundredths.
   *
   * <p>Malformed input yields 0 and a warning; this never throws.
   */
  public static long convertStringToMilliseconds(String timestamp) {
    if (timestamp == null) {
      LOGGER.warn("Cannot parse null timestamp");
      return 0;
    }
    Matcher matcher = TIMESTAMP_PATTERN.matcher(timestamp.trim());
    if (!matcher.matches()) {
      LOGGER.warn("Cannot parse timestamp: '{}'", timestamp);
      return 0;
    }
    try {
      long hours = Long.parseLong(matcher.group(1));
      long minutes = Long.parseLong(matcher.group(2));
      long seconds = Long.parseLong(matcher.group(3));
      long millis = fractionToMillis(matcher.group(4));
      return ((hours * 3600) + (minutes * 60) + seconds) * 1000 + millis;
    } catch (NumberFormatException e) {
      LOGGER.warn("Cannot parse timestamp: '{}' ({})", timestamp, e.getMessage());
      return 0;
    }
  }

  /** Render seconds as {@code HH:MM:SS.mmm}, for log lines. */
  public static String secondsToTimeFormat(double seconds) {
    long totalMillis = Math.round(Math.max(0, seconds) * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis / 60_000) % 60;
    long secs = (totalMillis / 1000) % 60;
    long millis = totalMillis % 1000;
    return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, secs, millis);
  }

  /** Seconds as a plain decimal for command arguments: 40.0 becomes "40", 22.5 stays "22.5". */
  public static String formatSeconds(double seconds) {
    BigDecimal value = BigDecimal.valueOf(seconds).stripTrailingZeros();
    return value.scale() < 0 ? value.setScale(0).toPlainString() : value.toPlainString();
  }

  private static long fractionToMillis(String fraction) {
    if (fraction == null || fraction.isEmpty()) {
      return 0;
    }
    if (fraction.length() >= 3) {
      return Long.parseLong(fraction.substring(0, 3));
    }
    long value = Long.parseLong(fraction);
    return fraction.length() == 1 ? value * 100 : value * 10;
  }
}
