package ca.gc.cra.helio.infrastructure.metrics;

import ca.gc.cra.helio.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected by {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  /** Creates a no-op metrics adapter. */
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
