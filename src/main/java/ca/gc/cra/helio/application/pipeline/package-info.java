/**
 * <strong>Purpose:</strong> The acquire pipeline: per-channel fetch and normalization, concurrent waves,
 * timestamp reconciliation, and container assembly.
 * <p><strong>Pipeline role:</strong> Driven by {@code helio acquire} through {@link
 * ca.gc.cra.helio.application.pipeline.AcquireUseCase}.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.helio.application.pipeline.WaveExecutor} owns all worker
 * threads; every other type runs on the caller's thread.
 * <p><strong>Observability:</strong> SLF4J logging with MDC keys {@code helio.run} and {@code channelId}; metrics
 * through {@link ca.gc.cra.helio.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.application.pipeline;
