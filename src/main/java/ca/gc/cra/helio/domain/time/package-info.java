/**
 * Timestamp layouts shared by the source query, filename metadata, container header, and sidecar file.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.domain.time;
