package ca.gc.cra.helio.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying the wall-clock instant used as the default nominal capture time.
 * <p><strong>Why:</strong> Lets tests pin "now" so acquisitions and file names are reproducible.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.helio.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current UTC instant
   */
  Instant now();

  /** Default clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
