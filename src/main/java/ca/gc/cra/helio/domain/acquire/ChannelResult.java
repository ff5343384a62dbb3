package ca.gc.cra.helio.domain.acquire;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Decoded, normalized image data for one channel together with its capture instant.
 * <p><strong>Why:</strong> Carries everything the assembler needs so no container layout has to reach back into the
 * fetch layer.</p>
 * <p><strong>Role:</strong> Domain value produced by a wave task and consumed once by the orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the buffer is copied on construction and on access.</p>
 *
 * @param channelId source channel identifier
 * @param actualTimestamp capture instant reported by the source, or the nominal instant when unreported
 * @param buffer grayscale plane or encoded image bytes, depending on the color policy
 * @param width raster width in pixels
 * @param height raster height in pixels
 * @since 0.1.0
 */
public record ChannelResult(int channelId, Instant actualTimestamp, byte[] buffer, int width, int height) {
  /**
   * Copies the buffer and validates dimensions.
   *
   * @throws IllegalArgumentException if a dimension is not positive
   */
  public ChannelResult {
    Objects.requireNonNull(actualTimestamp, "actualTimestamp");
    buffer = Objects.requireNonNull(buffer, "buffer").clone();
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("dimensions must be positive (was " + width + "x" + height + ")");
    }
  }

  /**
   * Returns a copy of the channel buffer.
   *
   * @return buffer copy owned by the caller
   */
  @Override
  public byte[] buffer() {
    return buffer.clone();
  }

  /**
   * Returns the buffer length without copying.
   *
   * @return number of bytes in the buffer
   */
  public int length() {
    return buffer.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChannelResult that)) {
      return false;
    }
    return channelId == that.channelId
        && width == that.width
        && height == that.height
        && actualTimestamp.equals(that.actualTimestamp)
        && Arrays.equals(buffer, that.buffer);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(channelId);
    result = 31 * result + actualTimestamp.hashCode();
    result = 31 * result + Arrays.hashCode(buffer);
    result = 31 * result + Integer.hashCode(width);
    result = 31 * result + Integer.hashCode(height);
    return result;
  }

  @Override
  public String toString() {
    return "ChannelResult{"
        + "channelId=" + channelId
        + ", actualTimestamp=" + actualTimestamp
        + ", bytes=" + buffer.length
        + ", width=" + width
        + ", height=" + height
        + '}';
  }
}
