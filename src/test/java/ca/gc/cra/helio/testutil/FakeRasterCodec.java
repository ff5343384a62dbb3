package ca.gc.cra.helio.testutil;

import ca.gc.cra.helio.application.port.RasterCodecPort;
import ca.gc.cra.helio.domain.raster.GrayRaster;
import java.io.IOException;
import java.util.Arrays;

/**
 * Codec over a toy encoding: {@code [width, height, fill]} describes a uniformly filled raster.
 */
public class FakeRasterCodec implements RasterCodecPort {

  /**
   * Encodes a uniform raster in the toy format.
   */
  public static byte[] image(int width, int height, int fill) {
    return new byte[] {(byte) width, (byte) height, (byte) fill};
  }

  @Override
  public GrayRaster decodeGray(byte[] encoded) throws IOException {
    if (encoded.length != 3) {
      throw new IOException("not a toy image: " + encoded.length + " bytes");
    }
    int width = Byte.toUnsignedInt(encoded[0]);
    int height = Byte.toUnsignedInt(encoded[1]);
    byte[] pixels = new byte[width * height];
    Arrays.fill(pixels, encoded[2]);
    return new GrayRaster(width, height, pixels);
  }

  @Override
  public GrayRaster resample(GrayRaster source, int width, int height) {
    byte[] pixels = new byte[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int sx = x * source.width() / width;
        int sy = y * source.height() / height;
        pixels[y * width + x] = source.pixels()[sy * source.width() + sx];
      }
    }
    return new GrayRaster(width, height, pixels);
  }

  @Override
  public byte[] encode(GrayRaster raster, String format) {
    return image(raster.width(), raster.height(), raster.pixels()[0]);
  }
}
