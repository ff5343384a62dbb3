package ca.gc.cra.helio.domain.time;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Formatting and parsing rules for every instant HELIO reads or writes.
 * <p><strong>Why:</strong> The source query, the container header, the sidecar file, and the filename metadata
 * each use a fixed textual layout; keeping them together prevents drift between producer and consumer.</p>
 * <p><strong>Role:</strong> Domain utility used by the fetcher, the assembler, and the output adapters.</p>
 * <p><strong>Thread-safety:</strong> Stateless; formatters are immutable.</p>
 *
 * <p>Filename metadata layout: {@code yyyy_MM_dd__HH_mm_ss[_SSS]__<ignored...>}, for example
 * {@code 2025_12_30__14_01_21_349__SDO_AIA_AIA_171.jp2}. All instants are UTC.</p>
 *
 * @since 0.1.0
 */
public final class CaptureTimestamps {
  /** Length in bytes of the header/sidecar timestamp text. */
  public static final int HEADER_LENGTH = 19;

  private static final DateTimeFormatter HEADER =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter QUERY =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter COMPACT =
      DateTimeFormatter.ofPattern("uuuuMMdd_HHmmss").withZone(ZoneOffset.UTC);
  private static final String SEGMENT_DELIMITER = "__";

  private CaptureTimestamps() {}

  /**
   * Formats an instant as the 19-character {@code yyyy-MM-dd HH:mm:ss} header text.
   *
   * @param instant instant to format; sub-second fields are dropped
   * @return header text
   */
  public static String formatHeader(Instant instant) {
    return HEADER.format(Objects.requireNonNull(instant, "instant"));
  }

  /**
   * Encodes the header text as exactly {@link #HEADER_LENGTH} ASCII bytes.
   *
   * @param instant instant to encode
   * @return ASCII bytes of the header text
   */
  public static byte[] headerBytes(Instant instant) {
    byte[] bytes = formatHeader(instant).getBytes(StandardCharsets.US_ASCII);
    if (bytes.length != HEADER_LENGTH) {
      throw new IllegalArgumentException("Timestamp outside the four-digit year range: " + instant);
    }
    return bytes;
  }

  /**
   * Parses header text back into an instant.
   *
   * @param text 19-character header text
   * @return parsed UTC instant
   * @throws DateTimeParseException if the text does not follow the header layout
   */
  public static Instant parseHeader(String text) {
    return LocalDateTime.parse(text, HEADER).toInstant(ZoneOffset.UTC);
  }

  /**
   * Formats an instant for source queries ({@code yyyy-MM-ddTHH:mm:ssZ}).
   *
   * @param instant instant to format
   * @return query text at second precision
   */
  public static String formatQuery(Instant instant) {
    return QUERY.format(Objects.requireNonNull(instant, "instant"));
  }

  /**
   * Formats an instant for file names ({@code yyyyMMdd_HHmmss}).
   *
   * @param instant instant to format
   * @return compact text
   */
  public static String formatCompact(Instant instant) {
    return COMPACT.format(Objects.requireNonNull(instant, "instant"));
  }

  /**
   * Parses an operator-supplied nominal timestamp in header layout or ISO-8601 instant layout.
   *
   * @param raw text such as {@code 2025-12-30 14:00:00} or {@code 2025-12-30T14:00:00Z}
   * @return parsed instant truncated to seconds
   * @throws IllegalArgumentException if neither layout matches
   */
  public static Instant parseNominal(String raw) {
    String trimmed = Objects.requireNonNull(raw, "raw").trim();
    try {
      if (trimmed.indexOf('T') > 0) {
        return Instant.parse(trimmed).truncatedTo(ChronoUnit.SECONDS);
      }
      return parseHeader(trimmed);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(
          "timestamp must be 'yyyy-MM-dd HH:mm:ss' or ISO-8601 (was '" + raw + "')", ex);
    }
  }

  /**
   * Extracts the capture instant encoded in a source filename.
   *
   * @param filename original filename reported by the source; may be {@code null}
   * @param precision precision to retain
   * @return capture instant, or empty when the filename is absent or does not follow the layout
   */
  public static Optional<Instant> parseFilename(String filename, TimestampPrecision precision) {
    if (filename == null || filename.isBlank()) {
      return Optional.empty();
    }
    String[] segments = filename.trim().split(SEGMENT_DELIMITER, -1);
    if (segments.length < 2) {
      return Optional.empty();
    }
    String[] date = segments[0].split("_", -1);
    String[] time = segments[1].split("_", -1);
    if (date.length != 3 || time.length < 3) {
      return Optional.empty();
    }
    try {
      LocalDate day = LocalDate.of(
          Integer.parseInt(date[0]), Integer.parseInt(date[1]), Integer.parseInt(date[2]));
      // The last time field may carry the file extension when no descriptor segment follows.
      int last = time.length - 1;
      time[last] = leadingDigits(time[last]);
      int nanos = 0;
      if (time.length > 3 && precision == TimestampPrecision.MILLIS) {
        nanos = parseMillis(time[3]) * 1_000_000;
      }
      LocalTime clock = LocalTime.of(
          Integer.parseInt(time[0]), Integer.parseInt(time[1]), Integer.parseInt(time[2]), nanos);
      return Optional.of(LocalDateTime.of(day, clock).toInstant(ZoneOffset.UTC));
    } catch (NumberFormatException | DateTimeException ex) {
      return Optional.empty();
    }
  }

  private static String leadingDigits(String field) {
    int end = 0;
    while (end < field.length() && Character.isDigit(field.charAt(end))) {
      end++;
    }
    return field.substring(0, end);
  }

  /** Returns 0 for a field that is not 1-3 digits, keeping second precision. */
  private static int parseMillis(String field) {
    if (field.isEmpty() || field.length() > 3) {
      return 0;
    }
    int value = Integer.parseInt(field);
    for (int i = field.length(); i < 3; i++) {
      value *= 10;
    }
    return value;
  }
}
