package ca.gc.cra.helio.domain.container;

import java.util.Arrays;
import java.util.Objects;

/**
 * Composite-schema record: an RGB image of {@code width * height * 3} interleaved bytes.
 *
 * <p>Carries no channel id; the record's position identifies which channel group it was built from.</p>
 *
 * @param width image width in pixels
 * @param height image height in pixels
 * @param rgb interleaved RGB bytes; copied on construction
 * @since 0.1.0
 */
public record CompositeRecord(int width, int height, byte[] rgb) implements ImageRecord {
  /** Field prefix: width (2), height (2). */
  public static final int PREFIX_LENGTH = 4;

  public CompositeRecord {
    rgb = Objects.requireNonNull(rgb, "rgb").clone();
  }

  @Override
  public byte[] rgb() {
    return rgb.clone();
  }

  @Override
  public long serializedLength() {
    return PREFIX_LENGTH + (long) rgb.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof CompositeRecord that
        && width == that.width
        && height == that.height
        && Arrays.equals(rgb, that.rgb);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(width, height) + Arrays.hashCode(rgb);
  }

  @Override
  public String toString() {
    return "CompositeRecord{" + width + "x" + height + ", bytes=" + rgb.length + '}';
  }
}
