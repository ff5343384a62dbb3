package ca.gc.cra.helio.domain.raster;

import java.util.Objects;

/**
 * Deterministic resampling rule applied to every decoded channel.
 *
 * @param kind scale by a factor or fit to a fixed size
 * @param scaleFactor factor used by {@link Kind#SCALE}
 * @param targetWidth width used by {@link Kind#FIT}
 * @param targetHeight height used by {@link Kind#FIT}
 * @since 0.1.0
 */
public record ResamplePolicy(Kind kind, double scaleFactor, int targetWidth, int targetHeight) {
  /** Resampling rule families. */
  public enum Kind {
    /** Output dims are {@code floor(input dims * factor)}. */
    SCALE,
    /** Output dims are fixed regardless of input aspect ratio. */
    FIT
  }

  public ResamplePolicy {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.SCALE && (!Double.isFinite(scaleFactor) || scaleFactor <= 0.0)) {
      throw new IllegalArgumentException("scaleFactor must be positive (was " + scaleFactor + ")");
    }
    if (kind == Kind.FIT && (targetWidth <= 0 || targetHeight <= 0)) {
      throw new IllegalArgumentException(
          "target size must be positive (was " + targetWidth + "x" + targetHeight + ")");
    }
  }

  /**
   * Scale-by-factor policy.
   *
   * @param factor scale factor, e.g. {@code 0.5}
   * @return policy
   */
  public static ResamplePolicy scale(double factor) {
    return new ResamplePolicy(Kind.SCALE, factor, 0, 0);
  }

  /**
   * Fit-to-size policy.
   *
   * @param width target width
   * @param height target height
   * @return policy
   */
  public static ResamplePolicy fit(int width, int height) {
    return new ResamplePolicy(Kind.FIT, 1.0, width, height);
  }

  /**
   * Computes output width for an input width.
   *
   * @param inputWidth decoded width
   * @return resampled width, at least 1
   */
  public int outputWidth(int inputWidth) {
    return kind == Kind.FIT ? targetWidth : Math.max(1, (int) Math.floor(inputWidth * scaleFactor));
  }

  /**
   * Computes output height for an input height.
   *
   * @param inputHeight decoded height
   * @return resampled height, at least 1
   */
  public int outputHeight(int inputHeight) {
    return kind == Kind.FIT ? targetHeight : Math.max(1, (int) Math.floor(inputHeight * scaleFactor));
  }
}
