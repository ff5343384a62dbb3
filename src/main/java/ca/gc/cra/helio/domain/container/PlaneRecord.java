package ca.gc.cra.helio.domain.container;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw-schema record: one grayscale plane of {@code width * height} bytes.
 *
 * @param channelId source channel identifier
 * @param width plane width in pixels
 * @param height plane height in pixels
 * @param pixels grayscale bytes, row-major; copied on construction
 * @since 0.1.0
 */
public record PlaneRecord(int channelId, int width, int height, byte[] pixels) implements ImageRecord {
  /** Field prefix: channel id (1), width (2), height (2). */
  public static final int PREFIX_LENGTH = 5;

  public PlaneRecord {
    pixels = Objects.requireNonNull(pixels, "pixels").clone();
  }

  @Override
  public byte[] pixels() {
    return pixels.clone();
  }

  @Override
  public long serializedLength() {
    return PREFIX_LENGTH + (long) pixels.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof PlaneRecord that
        && channelId == that.channelId
        && width == that.width
        && height == that.height
        && Arrays.equals(pixels, that.pixels);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(channelId, width, height) + Arrays.hashCode(pixels);
  }

  @Override
  public String toString() {
    return "PlaneRecord{channelId=" + channelId + ", " + width + "x" + height + ", bytes=" + pixels.length + '}';
  }
}
