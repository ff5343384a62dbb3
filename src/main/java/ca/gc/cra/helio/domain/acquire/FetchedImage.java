package ca.gc.cra.helio.domain.acquire;

import java.util.Objects;
import java.util.Optional;

/**
 * Encoded image bytes delivered by the source for one channel, plus the original filename it reported.
 *
 * @param channelId channel the bytes belong to
 * @param encoded encoded image bytes; never empty
 * @param filename original filename from response metadata, if any
 * @since 0.1.0
 */
public record FetchedImage(int channelId, byte[] encoded, Optional<String> filename) {
  public FetchedImage {
    encoded = Objects.requireNonNull(encoded, "encoded").clone();
    filename = filename == null ? Optional.empty() : filename;
  }

  @Override
  public byte[] encoded() {
    return encoded.clone();
  }

  @Override
  public String toString() {
    return "FetchedImage{channelId=" + channelId + ", bytes=" + encoded.length + ", filename=" + filename + '}';
  }
}
