package ca.gc.cra.helio.domain.raster;

/**
 * Form of the buffer produced for each channel.
 *
 * @since 0.1.0
 */
public enum ColorPolicy {
  /** One byte per pixel. */
  GRAYSCALE,
  /** The resampled grayscale raster re-encoded as an image file (e.g. PNG). */
  ENCODED
}
