/**
 * Image decoding, Lanczos resampling, and encoding on {@code javax.imageio}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.infrastructure.raster;
