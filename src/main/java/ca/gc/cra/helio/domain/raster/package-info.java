/**
 * Raster values and the resampling/color rules applied to each fetched channel.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.domain.raster;
