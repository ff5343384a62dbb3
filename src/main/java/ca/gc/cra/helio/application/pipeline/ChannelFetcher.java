package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.application.port.ChannelSourcePort;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.FetchedImage;
import ca.gc.cra.helio.domain.acquire.TransportException;
import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import ca.gc.cra.helio.domain.time.TimestampPrecision;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fetches one channel's encoded image and resolves its actual capture instant.
 * <p><strong>Why:</strong> The archive returns the image nearest the requested instant; the true capture time is
 * only visible in the filename it reports.</p>
 * <p><strong>Role:</strong> First step of every wave task.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when the underlying {@link ChannelSourcePort} is.</p>
 *
 * @since 0.1.0
 */
public final class ChannelFetcher {
  private static final Logger log = LoggerFactory.getLogger(ChannelFetcher.class);

  private final ChannelSourcePort source;
  private final TimestampPrecision precision;

  /**
   * Creates a fetcher.
   *
   * @param source channel source
   * @param precision precision kept when reading filename timestamps
   */
  public ChannelFetcher(ChannelSourcePort source, TimestampPrecision precision) {
    this.source = Objects.requireNonNull(source, "source");
    this.precision = Objects.requireNonNull(precision, "precision");
  }

  /**
   * Fetches the encoded image for a request.
   *
   * @param request channel and nominal instant
   * @return fetched image with non-empty bytes
   * @throws TransportException if the source fails or returns no bytes
   */
  public FetchedImage fetch(ChannelRequest request) throws TransportException {
    Objects.requireNonNull(request, "request");
    FetchedImage image = source.fetch(request);
    if (image == null || image.encoded().length == 0) {
      throw new TransportException(request.channelId(), "source returned an empty body");
    }
    log.debug("Fetched {} bytes (filename={})", image.encoded().length, image.filename().orElse("<none>"));
    return image;
  }

  /**
   * Resolves the actual capture instant from the reported filename, falling back to the nominal instant.
   *
   * @param image fetched image
   * @param nominal instant that was requested
   * @return parsed filename instant, or {@code nominal} when the filename is absent or malformed
   */
  public Instant actualTimestamp(FetchedImage image, Instant nominal) {
    Optional<String> filename = image.filename();
    Optional<Instant> parsed = CaptureTimestamps.parseFilename(filename.orElse(null), precision);
    if (parsed.isPresent()) {
      return parsed.get();
    }
    if (filename.isPresent()) {
      log.warn("Unparseable capture filename '{}'; using nominal timestamp {}", filename.get(), nominal);
    } else {
      log.debug("No capture filename reported; using nominal timestamp {}", nominal);
    }
    return nominal;
  }
}
