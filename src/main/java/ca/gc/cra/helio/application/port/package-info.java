/**
 * <strong>Purpose:</strong> Ports the acquire pipeline depends on: the channel source, the raster codec, container
 * output, clock, and metrics.
 * <p><strong>Pipeline role:</strong> Implemented by adapters under {@code ca.gc.cra.helio.infrastructure}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.application.port;
