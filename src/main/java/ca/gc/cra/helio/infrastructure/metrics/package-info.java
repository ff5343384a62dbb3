/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.helio.application.port.MetricsPort} adapters.
 * <p>The OpenTelemetry adapter reads its exporter settings from {@code otel.*} system properties, which the CLI
 * populates from {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.infrastructure.metrics;
