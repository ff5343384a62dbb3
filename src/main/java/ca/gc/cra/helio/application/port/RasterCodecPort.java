package ca.gc.cra.helio.application.port;

import ca.gc.cra.helio.domain.raster.GrayRaster;
import java.io.IOException;

/**
 * <strong>What:</strong> Image decoding, resampling, and encoding capability used by normalization.
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or otherwise thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.helio.infrastructure.raster.ImageIoRasterCodec
 */
public interface RasterCodecPort {
  /**
   * Decodes an encoded image and converts it to eight-bit grayscale.
   *
   * @param encoded encoded image bytes
   * @return grayscale raster
   * @throws IOException if the bytes are not a decodable image
   */
  GrayRaster decodeGray(byte[] encoded) throws IOException;

  /**
   * Resamples a raster with a Lanczos filter.
   *
   * @param source raster to resample
   * @param width output width
   * @param height output height
   * @return resampled raster; {@code source} itself when the size already matches
   */
  GrayRaster resample(GrayRaster source, int width, int height);

  /**
   * Encodes a grayscale raster as an image file.
   *
   * @param raster raster to encode
   * @param format image format name, e.g. {@code png}
   * @return encoded bytes
   * @throws IOException if no writer exists for the format or encoding fails
   */
  byte[] encode(GrayRaster raster, String format) throws IOException;
}
