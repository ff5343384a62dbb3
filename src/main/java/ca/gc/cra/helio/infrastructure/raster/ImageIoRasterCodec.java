package ca.gc.cra.helio.infrastructure.raster;

import ca.gc.cra.helio.application.port.RasterCodecPort;
import ca.gc.cra.helio.domain.raster.GrayRaster;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import javax.imageio.ImageIO;

/**
 * {@link RasterCodecPort} built on {@code javax.imageio}.
 *
 * <p>JPEG 2000 input is readable when the jai-imageio JPEG 2000 plugin is on the classpath; PNG and the other JDK
 * formats are always available. Colour input is reduced to Rec. 709 luma.</p>
 *
 * @since 0.1.0
 */
public final class ImageIoRasterCodec implements RasterCodecPort {

  @Override
  public GrayRaster decodeGray(byte[] encoded) throws IOException {
    Objects.requireNonNull(encoded, "encoded");
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
    if (image == null) {
      throw new IOException("no ImageIO reader recognises the image data (" + encoded.length + " bytes)");
    }
    return toGray(image);
  }

  @Override
  public GrayRaster resample(GrayRaster source, int width, int height) {
    return LanczosResampler.resample(Objects.requireNonNull(source, "source"), width, height);
  }

  @Override
  public byte[] encode(GrayRaster raster, String format) throws IOException {
    Objects.requireNonNull(raster, "raster");
    BufferedImage image = new BufferedImage(raster.width(), raster.height(), BufferedImage.TYPE_BYTE_GRAY);
    image.getRaster().setDataElements(0, 0, raster.width(), raster.height(), raster.pixels());
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    if (!ImageIO.write(image, format, out)) {
      throw new IOException("no ImageIO writer for format " + format);
    }
    return out.toByteArray();
  }

  static GrayRaster toGray(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    if (image.getType() == BufferedImage.TYPE_BYTE_GRAY
        && image.getRaster().getDataBuffer() instanceof DataBufferByte buffer
        && buffer.getNumBanks() == 1
        && buffer.getData().length == width * height) {
      return new GrayRaster(width, height, buffer.getData().clone());
    }
    byte[] pixels = new byte[Math.multiplyExact(width, height)];
    int[] row = new int[width];
    for (int y = 0; y < height; y++) {
      image.getRGB(0, y, width, 1, row, 0, width);
      for (int x = 0; x < width; x++) {
        int rgb = row[x];
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        pixels[y * width + x] = (byte) Math.round(0.2126 * r + 0.7152 * g + 0.0722 * b);
      }
    }
    return new GrayRaster(width, height, pixels);
  }
}
