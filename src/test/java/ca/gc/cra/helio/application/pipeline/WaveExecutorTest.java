package ca.gc.cra.helio.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import ca.gc.cra.helio.domain.acquire.TransportException;
import ca.gc.cra.helio.testutil.RecordingMetrics;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class WaveExecutorTest {
  private static final Instant NOMINAL = Instant.parse("2025-12-30T14:00:00Z");

  @Test
  void attemptsFollowRequestOrderAndFailuresAreCounted() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    WaveExecutor executor = new WaveExecutor(request -> {
      if (request.channelId() == 10) {
        throw new TransportException(10, "HTTP 503 from host");
      }
      return result(request);
    }, 4, metrics);

    List<ChannelAttempt> attempts = executor.run("wave", requests(9, 10, 11));

    assertEquals(List.of(9, 10, 11), attempts.stream().map(a -> a.request().channelId()).toList());
    assertFalse(attempts.get(1).succeeded());
    assertEquals(2, metrics.count("acquire.channel.fetched"));
    assertEquals(1, metrics.count("acquire.channel.failed"));
    assertEquals(1, metrics.observed("acquire.wave.latencyMillis").size());
  }

  @Test
  void concurrencyIsBoundedAndChannelIdIsInMdc() throws Exception {
    AtomicInteger active = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    Map<Integer, String> mdcSeen = new ConcurrentHashMap<>();
    Map<Integer, String> threads = new ConcurrentHashMap<>();
    WaveExecutor executor = new WaveExecutor(request -> {
      int now = active.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      mdcSeen.put(request.channelId(), MDC.get(WaveExecutor.MDC_CHANNEL));
      threads.put(request.channelId(), Thread.currentThread().getName());
      try {
        Thread.sleep(30);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      active.decrementAndGet();
      return result(request);
    }, 2, new RecordingMetrics());

    List<ChannelAttempt> attempts = executor.run("anchored", requests(1, 2, 3, 4, 5));

    assertEquals(5, attempts.size());
    assertTrue(peak.get() <= 2, "at most two channels in flight, saw " + peak.get());
    assertEquals("3", mdcSeen.get(3));
    assertTrue(threads.get(1).startsWith("helio-anchored-"));
  }

  @Test
  void unexpectedRuntimeFailurePropagates() {
    WaveExecutor executor = new WaveExecutor(request -> {
      throw new IllegalStateException("decoder bug");
    }, 2, new RecordingMetrics());

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> executor.run("wave", requests(1, 2)));
    assertEquals("decoder bug", ex.getMessage());
  }

  @Test
  void singleRequestRunsOnCallingThread() throws Exception {
    String caller = Thread.currentThread().getName();
    List<String> seen = new ArrayList<>();
    WaveExecutor executor = new WaveExecutor(request -> {
      seen.add(Thread.currentThread().getName());
      return result(request);
    }, 4, new RecordingMetrics());

    executor.run("reference", requests(19));

    assertEquals(List.of(caller), seen);
  }

  private static List<ChannelRequest> requests(int... channels) {
    List<ChannelRequest> list = new ArrayList<>();
    for (int channel : channels) {
      list.add(new ChannelRequest(channel, NOMINAL));
    }
    return list;
  }

  private static ChannelResult result(ChannelRequest request) {
    return new ChannelResult(request.channelId(), request.nominalTimestamp(), new byte[4], 2, 2);
  }
}
