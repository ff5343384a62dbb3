package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.application.port.RasterCodecPort;
import ca.gc.cra.helio.domain.acquire.DecodeException;
import ca.gc.cra.helio.domain.raster.ColorPolicy;
import ca.gc.cra.helio.domain.raster.GrayRaster;
import ca.gc.cra.helio.domain.raster.NormalizationPolicy;
import ca.gc.cra.helio.domain.raster.NormalizedRaster;
import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Decodes, resamples, optionally mirrors, and re-encodes one channel's image.
 * <p><strong>Role:</strong> Second step of every wave task; produces the buffer stored in a
 * {@link ca.gc.cra.helio.domain.acquire.ChannelResult}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators.</p>
 *
 * @since 0.1.0
 */
public final class RasterNormalizer {
  private final RasterCodecPort codec;
  private final NormalizationPolicy policy;

  /**
   * Creates a normalizer.
   *
   * @param codec raster codec
   * @param policy normalization rule applied to every channel
   */
  public RasterNormalizer(RasterCodecPort codec, NormalizationPolicy policy) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * Returns the configured policy.
   *
   * @return normalization policy
   */
  public NormalizationPolicy policy() {
    return policy;
  }

  /**
   * Normalizes an encoded image.
   *
   * @param channelId channel the bytes belong to, used for error attribution and mirroring
   * @param encoded encoded image bytes
   * @return normalized buffer with its raster dimensions
   * @throws DecodeException if decoding or re-encoding fails, or the plane length check fails
   */
  public NormalizedRaster normalize(int channelId, byte[] encoded) throws DecodeException {
    GrayRaster decoded;
    try {
      decoded = codec.decodeGray(encoded);
    } catch (IOException | RuntimeException ex) {
      throw new DecodeException(channelId, "unable to decode image: " + ex.getMessage(), ex);
    }
    int width = policy.resample().outputWidth(decoded.width());
    int height = policy.resample().outputHeight(decoded.height());
    GrayRaster raster = codec.resample(decoded, width, height);
    if (policy.mirrors(channelId)) {
      raster = raster.mirrorHorizontal();
    }

    if (policy.color() == ColorPolicy.ENCODED) {
      try {
        return new NormalizedRaster(codec.encode(raster, policy.encodedFormat()), raster.width(), raster.height());
      } catch (IOException ex) {
        throw new DecodeException(channelId, "unable to encode " + policy.encodedFormat() + ": " + ex.getMessage(), ex);
      }
    }

    byte[] plane = raster.pixels();
    if (policy.verifyPlaneLength()) {
      long expected = (long) width * height;
      if (raster.width() != width || raster.height() != height || plane.length != expected) {
        throw new DecodeException(channelId, "plane length " + plane.length + " does not match "
            + width + "x" + height + " (" + expected + " bytes)");
      }
    }
    return new NormalizedRaster(plane, raster.width(), raster.height());
  }
}
