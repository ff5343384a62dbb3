package ca.gc.cra.helio.application.port;

/**
 * <strong>What:</strong> Port abstracting HELIO metrics emission.
 * <p><strong>Why:</strong> Allows the acquire pipeline to record counters and latency observations without binding
 * to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from wave worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code acquire.channel.fetched}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value (milliseconds, bytes, counts)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
