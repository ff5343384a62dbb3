package ca.gc.cra.helio.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.FetchedImage;
import ca.gc.cra.helio.domain.acquire.TransportException;
import ca.gc.cra.helio.domain.time.TimestampPrecision;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ChannelFetcherTest {
  private static final Instant NOMINAL = Instant.parse("2025-12-30T14:00:00Z");

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ChannelFetcher.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void emptyBodyIsTransportFailure() {
    ChannelFetcher fetcher = new ChannelFetcher(
        request -> new FetchedImage(request.channelId(), new byte[0], Optional.empty()),
        TimestampPrecision.SECONDS);

    TransportException ex = assertThrows(TransportException.class,
        () -> fetcher.fetch(new ChannelRequest(9, NOMINAL)));
    assertEquals(9, ex.channelId());
  }

  @Test
  void actualTimestampComesFromFilename() {
    ChannelFetcher fetcher = new ChannelFetcher(request -> null, TimestampPrecision.MILLIS);
    FetchedImage image = new FetchedImage(
        9, new byte[] {1}, Optional.of("2025_12_30__13_59_54_340__SDO_AIA_AIA_94.jp2"));

    assertEquals(Instant.parse("2025-12-30T13:59:54.340Z"), fetcher.actualTimestamp(image, NOMINAL));
  }

  @Test
  void unparseableFilenameFallsBackToNominalWithWarning() {
    ChannelFetcher fetcher = new ChannelFetcher(request -> null, TimestampPrecision.SECONDS);
    FetchedImage image = new FetchedImage(9, new byte[] {1}, Optional.of("latest.jp2"));

    assertEquals(NOMINAL, fetcher.actualTimestamp(image, NOMINAL));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("latest.jp2")));
  }

  @Test
  void missingFilenameFallsBackToNominal() {
    ChannelFetcher fetcher = new ChannelFetcher(request -> null, TimestampPrecision.SECONDS);

    assertEquals(NOMINAL,
        fetcher.actualTimestamp(new FetchedImage(9, new byte[] {1}, Optional.empty()), NOMINAL));
  }
}
