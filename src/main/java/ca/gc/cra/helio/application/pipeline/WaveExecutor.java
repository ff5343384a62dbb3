package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.application.port.MetricsPort;
import ca.gc.cra.helio.domain.acquire.ChannelException;
import ca.gc.cra.helio.domain.acquire.ChannelFailure;
import ca.gc.cra.helio.domain.acquire.ChannelRequest;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import ca.gc.cra.helio.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one wave of channel acquisitions concurrently and waits for all of them.
 * <p><strong>Why:</strong> Channels are independent network round trips; fanning them out bounds the batch latency
 * by the slowest channel rather than the sum.</p>
 * <p><strong>Role:</strong> Concurrency primitive used by {@link AcquisitionOrchestrator}.</p>
 * <p><strong>Thread-safety:</strong> Each {@link #run} call owns a dedicated pool that is shut down before it
 * returns; concurrent calls do not share state.</p>
 * <p><strong>Observability:</strong> Emits {@code acquire.channel.fetched}, {@code acquire.channel.failed}, and
 * {@code acquire.wave.latencyMillis}; sets MDC {@code channelId} for the duration of each task.</p>
 *
 * @since 0.1.0
 */
public final class WaveExecutor {
  private static final Logger log = LoggerFactory.getLogger(WaveExecutor.class);
  static final String MDC_CHANNEL = "channelId";

  private final ChannelAcquirer acquirer;
  private final int maxConcurrency;
  private final MetricsPort metrics;

  /**
   * Creates a wave executor.
   *
   * @param acquirer per-channel unit of work
   * @param maxConcurrency upper bound on worker threads per wave
   * @param metrics metrics sink
   */
  public WaveExecutor(ChannelAcquirer acquirer, int maxConcurrency, MetricsPort metrics) {
    this.acquirer = Objects.requireNonNull(acquirer, "acquirer");
    if (maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be positive");
    }
    this.maxConcurrency = maxConcurrency;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs every request and returns one attempt per request, in request order.
   *
   * @param waveName short label used in thread names and logs
   * @param requests requests to run
   * @return attempts in the same order as {@code requests}
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public List<ChannelAttempt> run(String waveName, List<ChannelRequest> requests) throws InterruptedException {
    Objects.requireNonNull(requests, "requests");
    if (requests.isEmpty()) {
      return List.of();
    }
    long start = System.nanoTime();
    List<ChannelAttempt> attempts = requests.size() == 1
        ? List.of(attempt(requests.get(0)))
        : runInParallel(waveName, requests);
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    metrics.observe("acquire.wave.latencyMillis", elapsedMillis);
    long ok = attempts.stream().filter(ChannelAttempt::succeeded).count();
    log.info("Wave {} finished: {}/{} channels in {} ms", waveName, ok, attempts.size(), elapsedMillis);
    return attempts;
  }

  private List<ChannelAttempt> runInParallel(String waveName, List<ChannelRequest> requests)
      throws InterruptedException {
    List<Callable<ChannelAttempt>> tasks = new ArrayList<>(requests.size());
    for (ChannelRequest request : requests) {
      tasks.add(() -> attempt(request));
    }
    int poolSize = Math.min(requests.size(), maxConcurrency);
    ExecutorService executor = ExecutorFactories.newWavePool(
        poolSize,
        "helio-" + waveName,
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    try {
      List<Future<ChannelAttempt>> futures = executor.invokeAll(tasks);
      return collect(futures);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Wave {} interrupted; requesting shutdown", waveName);
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }
  }

  private static List<ChannelAttempt> collect(List<Future<ChannelAttempt>> futures) throws InterruptedException {
    List<ChannelAttempt> attempts = new ArrayList<>(futures.size());
    for (Future<ChannelAttempt> future : futures) {
      try {
        attempts.add(future.get());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException runtime) {
          throw runtime;
        }
        if (cause instanceof Error error) {
          throw error;
        }
        throw new IllegalStateException("Wave task failed", cause);
      }
    }
    return attempts;
  }

  private ChannelAttempt attempt(ChannelRequest request) {
    String previous = MDC.get(MDC_CHANNEL);
    MDC.put(MDC_CHANNEL, Integer.toString(request.channelId()));
    try {
      ChannelResult result = acquirer.acquire(request);
      metrics.increment("acquire.channel.fetched");
      log.debug("Channel {} acquired at {} ({}x{}, {} bytes)",
          request.channelId(), result.actualTimestamp(), result.width(), result.height(), result.length());
      return ChannelAttempt.succeeded(request, result);
    } catch (ChannelException ex) {
      metrics.increment("acquire.channel.failed");
      log.warn("Channel {} failed: {}", request.channelId(), ex.detail());
      return ChannelAttempt.failed(request, ChannelFailure.from(ex));
    } finally {
      if (previous == null) {
        MDC.remove(MDC_CHANNEL);
      } else {
        MDC.put(MDC_CHANNEL, previous);
      }
    }
  }
}
