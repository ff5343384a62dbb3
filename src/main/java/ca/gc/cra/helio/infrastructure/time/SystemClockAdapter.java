package ca.gc.cra.helio.infrastructure.time;

import ca.gc.cra.helio.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}, UTC by default.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /** Creates an adapter over the system UTC clock. */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over the supplied clock, typically {@link Clock#fixed} in tests.
   *
   * @param clock backing clock
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Instant now() {
    return clock.instant();
  }
}
