package ca.gc.cra.helio.domain.raster;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Complete per-channel normalization rule.
 *
 * @param resample resampling rule
 * @param color buffer form
 * @param encodedFormat image format name used by {@link ColorPolicy#ENCODED}, e.g. {@code png}
 * @param verifyPlaneLength whether a grayscale buffer must be exactly {@code width * height} bytes
 * @param mirrorChannels channels mirrored left-right after resampling
 * @since 0.1.0
 */
public record NormalizationPolicy(
    ResamplePolicy resample,
    ColorPolicy color,
    String encodedFormat,
    boolean verifyPlaneLength,
    Set<Integer> mirrorChannels) {

  public NormalizationPolicy {
    Objects.requireNonNull(resample, "resample");
    Objects.requireNonNull(color, "color");
    encodedFormat = encodedFormat == null || encodedFormat.isBlank()
        ? "png"
        : encodedFormat.trim().toLowerCase(Locale.ROOT);
    mirrorChannels = mirrorChannels == null ? Set.of() : Set.copyOf(mirrorChannels);
  }

  /**
   * Returns whether the given channel is mirrored.
   *
   * @param channelId channel identifier
   * @return {@code true} when the channel is listed in {@link #mirrorChannels()}
   */
  public boolean mirrors(int channelId) {
    return mirrorChannels.contains(channelId);
  }
}
