package ca.gc.cra.helio.domain.raster;

import java.util.Objects;

/**
 * Output of normalization: a grayscale plane or an encoded image, with the raster dimensions.
 *
 * @param buffer plane bytes or encoded bytes, depending on the color policy
 * @param width raster width in pixels
 * @param height raster height in pixels
 * @since 0.1.0
 */
public record NormalizedRaster(byte[] buffer, int width, int height) {
  public NormalizedRaster {
    Objects.requireNonNull(buffer, "buffer");
  }
}
