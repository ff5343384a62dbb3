package ca.gc.cra.helio.domain.acquire;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> One channel to fetch within an acquisition wave.
 * <p><strong>Role:</strong> Domain value handed to the fetch+normalize task of a wave.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param channelId source channel identifier in {@code [0, 255]}
 * @param nominalTimestamp instant used to query the source; never {@code null}
 * @since 0.1.0
 */
public record ChannelRequest(int channelId, Instant nominalTimestamp) {
  /** Largest channel identifier that fits the one-byte container field. */
  public static final int MAX_CHANNEL_ID = 255;

  /**
   * Validates the channel identifier and timestamp.
   *
   * @throws IllegalArgumentException if {@code channelId} is outside {@code [0, 255]}
   */
  public ChannelRequest {
    if (channelId < 0 || channelId > MAX_CHANNEL_ID) {
      throw new IllegalArgumentException("channelId must be between 0 and 255 (was " + channelId + ")");
    }
    Objects.requireNonNull(nominalTimestamp, "nominalTimestamp");
  }
}
