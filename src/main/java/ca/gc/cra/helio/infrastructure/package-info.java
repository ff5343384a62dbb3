/**
 * Adapters implementing the application ports: HTTP source, raster codec, container output, metrics, clock, and
 * executors.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.infrastructure;
