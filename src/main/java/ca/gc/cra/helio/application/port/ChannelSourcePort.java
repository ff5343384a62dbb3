package ca.gc.cra.helio.application.port;

import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.FetchedImage;
import ca.gc.cra.helio.domain.acquire.TransportException;

/**
 * <strong>What:</strong> Port retrieving the encoded image nearest to a nominal instant for one channel.
 * <p><strong>Why:</strong> Keeps the archive transport (HTTP today) out of the acquisition logic so tests can
 * substitute scripted sources.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent {@link #fetch} calls; a wave fetches
 * several channels in parallel.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.helio.infrastructure.source.OkHttpChannelSource
 */
public interface ChannelSourcePort {
  /**
   * Fetches the encoded image for a channel.
   *
   * @param request channel and nominal instant
   * @return non-empty encoded bytes and the filename the source reported, if any
   * @throws TransportException on network failure, non-success status, or an empty body
   */
  FetchedImage fetch(ChannelRequest request) throws TransportException;
}
