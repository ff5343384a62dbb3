package ca.gc.cra.helio.domain.raster;

import java.util.Objects;

/**
 * Eight-bit grayscale raster stored row-major, one byte per pixel.
 *
 * <p>Instances own their pixel array; callers that keep a reference to the array passed in must not modify it
 * afterwards.</p>
 *
 * @param width width in pixels
 * @param height height in pixels
 * @param pixels row-major pixels of length {@code width * height}
 * @since 0.1.0
 */
public record GrayRaster(int width, int height, byte[] pixels) {
  public GrayRaster {
    Objects.requireNonNull(pixels, "pixels");
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("dimensions must be positive (was " + width + "x" + height + ")");
    }
    if ((long) width * height != pixels.length) {
      throw new IllegalArgumentException(
          "pixel buffer length " + pixels.length + " does not match " + width + "x" + height);
    }
  }

  /**
   * Creates an all-black raster.
   *
   * @param width width in pixels
   * @param height height in pixels
   * @return zero-filled raster
   */
  public static GrayRaster black(int width, int height) {
    return new GrayRaster(width, height, new byte[Math.multiplyExact(width, height)]);
  }

  /**
   * Returns a left-right mirrored copy.
   *
   * @return mirrored raster
   */
  public GrayRaster mirrorHorizontal() {
    byte[] out = new byte[pixels.length];
    for (int y = 0; y < height; y++) {
      int row = y * width;
      for (int x = 0; x < width; x++) {
        out[row + x] = pixels[row + width - 1 - x];
      }
    }
    return new GrayRaster(width, height, out);
  }

  @Override
  public String toString() {
    return "GrayRaster{" + width + "x" + height + '}';
  }
}
