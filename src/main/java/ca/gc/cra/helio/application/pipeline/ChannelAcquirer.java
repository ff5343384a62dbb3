package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.domain.acquire.ChannelException;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ChannelResult;

/**
 * Unit of work run once per channel inside a wave.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ChannelAcquirer {
  /**
   * Acquires and normalizes a single channel.
   *
   * @param request channel and nominal instant
   * @return successful result
   * @throws ChannelException when the channel cannot be fetched or decoded
   */
  ChannelResult acquire(ChannelRequest request) throws ChannelException;
}
