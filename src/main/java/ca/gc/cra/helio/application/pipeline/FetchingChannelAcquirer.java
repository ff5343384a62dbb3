package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.domain.acquire.ChannelException;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import ca.gc.cra.helio.domain.acquire.FetchedImage;
import ca.gc.cra.helio.domain.raster.NormalizedRaster;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ChannelAcquirer} that fetches through a {@link ChannelFetcher} and normalizes through a
 * {@link RasterNormalizer}.
 *
 * @since 0.1.0
 */
public final class FetchingChannelAcquirer implements ChannelAcquirer {
  private final ChannelFetcher fetcher;
  private final RasterNormalizer normalizer;

  /**
   * Creates the acquirer.
   *
   * @param fetcher channel fetcher
   * @param normalizer raster normalizer
   */
  public FetchingChannelAcquirer(ChannelFetcher fetcher, RasterNormalizer normalizer) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  @Override
  public ChannelResult acquire(ChannelRequest request) throws ChannelException {
    FetchedImage image = fetcher.fetch(request);
    Instant actual = fetcher.actualTimestamp(image, request.nominalTimestamp());
    NormalizedRaster raster = normalizer.normalize(request.channelId(), image.encoded());
    return new ChannelResult(request.channelId(), actual, raster.buffer(), raster.width(), raster.height());
  }
}
