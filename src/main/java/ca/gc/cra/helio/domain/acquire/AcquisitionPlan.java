package ca.gc.cra.helio.domain.acquire;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * <strong>What:</strong> Which channels to fetch and how to reconcile their timestamps.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param mode reconciliation mode
 * @param channels channels fetched in the (second) wave, in request order; duplicates rejected
 * @param referenceChannel reference channel, required for {@link ReconciliationMode#ANCHORED} only
 * @since 0.1.0
 */
public record AcquisitionPlan(ReconciliationMode mode, List<Integer> channels, OptionalInt referenceChannel) {

  /**
   * Validates the channel layout required by each mode.
   *
   * @throws IllegalArgumentException when the channels do not suit the mode
   */
  public AcquisitionPlan {
    Objects.requireNonNull(mode, "mode");
    channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
    referenceChannel = referenceChannel == null ? OptionalInt.empty() : referenceChannel;
    Set<Integer> unique = new LinkedHashSet<>(channels);
    if (unique.size() != channels.size()) {
      throw new IllegalArgumentException("channels must not contain duplicates: " + channels);
    }
    for (int channel : channels) {
      if (channel < 0 || channel > ChannelRequest.MAX_CHANNEL_ID) {
        throw new IllegalArgumentException("channel id out of range: " + channel);
      }
    }
    switch (mode) {
      case INDEPENDENT -> {
        if (channels.isEmpty()) {
          throw new IllegalArgumentException("INDEPENDENT mode requires at least one channel");
        }
      }
      case SINGLE -> {
        if (channels.size() != 1) {
          throw new IllegalArgumentException("SINGLE mode requires exactly one channel (was " + channels + ")");
        }
      }
      case ANCHORED -> {
        if (referenceChannel.isEmpty()) {
          throw new IllegalArgumentException("ANCHORED mode requires a reference channel");
        }
        if (unique.contains(referenceChannel.getAsInt())) {
          throw new IllegalArgumentException(
              "reference channel " + referenceChannel.getAsInt() + " must not also be listed in channels");
        }
      }
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
  }

  /**
   * Plan fetching every channel against the same nominal timestamp.
   *
   * @param channels channels in request order
   * @return independent plan
   */
  public static AcquisitionPlan independent(List<Integer> channels) {
    return new AcquisitionPlan(ReconciliationMode.INDEPENDENT, channels, OptionalInt.empty());
  }

  /**
   * Plan fetching {@code reference} first and {@code channels} at its actual timestamp.
   *
   * @param reference reference channel
   * @param channels second-wave channels in request order
   * @return anchored plan
   */
  public static AcquisitionPlan anchored(int reference, List<Integer> channels) {
    return new AcquisitionPlan(ReconciliationMode.ANCHORED, channels, OptionalInt.of(reference));
  }

  /**
   * Plan fetching exactly one channel.
   *
   * @param channel the channel
   * @return single-channel plan
   */
  public static AcquisitionPlan single(int channel) {
    return new AcquisitionPlan(ReconciliationMode.SINGLE, List.of(channel), OptionalInt.empty());
  }

  /**
   * Returns the number of channels the plan requests, reference included.
   *
   * @return requested channel count
   */
  public int requestedCount() {
    return channels.size() + (referenceChannel.isPresent() ? 1 : 0);
  }
}
