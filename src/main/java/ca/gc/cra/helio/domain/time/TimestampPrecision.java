package ca.gc.cra.helio.domain.time;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Precision retained when reading a capture instant from source filename metadata.
 *
 * @since 0.1.0
 */
public enum TimestampPrecision {
  /** Keep whole seconds; a millisecond sub-field is ignored. */
  SECONDS(ChronoUnit.SECONDS),
  /** Keep the millisecond sub-field when the filename carries one. */
  MILLIS(ChronoUnit.MILLIS);

  private final ChronoUnit unit;

  TimestampPrecision(ChronoUnit unit) {
    this.unit = unit;
  }

  /**
   * Truncates an instant to this precision.
   *
   * @param instant instant to truncate; must not be {@code null}
   * @return truncated instant
   */
  public Instant truncate(Instant instant) {
    return instant.truncatedTo(unit);
  }
}
