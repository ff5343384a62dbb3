package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.application.port.ClockPort;
import ca.gc.cra.helio.application.port.ContainerOutputPort;
import ca.gc.cra.helio.application.port.MetricsPort;
import ca.gc.cra.helio.application.port.RasterCodecPort;
import ca.gc.cra.helio.config.AcquireConfig;
import ca.gc.cra.helio.domain.acquire.AcquisitionException;
import ca.gc.cra.helio.domain.acquire.AcquisitionOutcome;
import ca.gc.cra.helio.domain.acquire.AcquisitionPlan;
import ca.gc.cra.helio.domain.acquire.ChannelFailure;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import ca.gc.cra.helio.domain.container.AssemblyException;
import ca.gc.cra.helio.domain.container.Container;
import ca.gc.cra.helio.domain.raster.ColorPolicy;
import ca.gc.cra.helio.domain.raster.GrayRaster;
import ca.gc.cra.helio.domain.raster.NormalizationPolicy;
import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one acquisition end to end: fetch, reconcile, assemble, and publish.
 * <p><strong>Why:</strong> Downstream consumers poll a single container file; it must only ever be replaced by a
 * complete, consistent batch.</p>
 * <p><strong>Role:</strong> Application use case behind {@code helio acquire}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the nominal timestamp (override or clock) and run the orchestrator.</li>
 *   <li>Log the per-channel offsets from the canonical timestamp.</li>
 *   <li>Write optional previews, then the container, then the sidecar timestamp.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #run()} invocations that share an
 * output destination.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code helio.run}; emits {@code container.bytes} and
 * {@code container.records}.</p>
 *
 * @since 0.1.0
 */
public final class AcquireUseCase {
  private static final Logger log = LoggerFactory.getLogger(AcquireUseCase.class);
  static final String MDC_RUN = "helio.run";
  private static final String PREVIEW_FORMAT = "png";

  private final AcquireConfig config;
  private final AcquisitionOrchestrator orchestrator;
  private final ContainerAssembler assembler;
  private final RasterCodecPort codec;
  private final ContainerOutputPort output;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param config run configuration
   * @param orchestrator acquisition orchestrator
   * @param assembler container assembler
   * @param codec raster codec used for previews
   * @param output container output port
   * @param clock clock supplying the default nominal timestamp
   * @param metrics metrics sink
   */
  public AcquireUseCase(
      AcquireConfig config,
      AcquisitionOrchestrator orchestrator,
      ContainerAssembler assembler,
      RasterCodecPort codec,
      ContainerOutputPort output,
      ClockPort clock,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.output = Objects.requireNonNull(output, "output");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Executes the acquisition.
   *
   * @return report describing what was written
   * @throws AcquisitionException if the reference or single channel fails, or nothing was acquired
   * @throws AssemblyException if the outcome cannot be laid out in the configured schema
   * @throws IOException if writing the container or sidecar fails
   * @throws InterruptedException if interrupted while waiting on a wave
   */
  public AcquireReport run() throws AcquisitionException, AssemblyException, IOException, InterruptedException {
    String previousRun = MDC.get(MDC_RUN);
    MDC.put(MDC_RUN, UUID.randomUUID().toString());
    try {
      Instant nominal = config.timestamp().orElseGet(clock::now).truncatedTo(ChronoUnit.SECONDS);
      AcquisitionPlan plan = config.plan();
      log.info("Acquiring {} channel(s) in {} mode at nominal {} (schema={})",
          plan.requestedCount(), plan.mode(), CaptureTimestamps.formatHeader(nominal), config.schema());

      AcquisitionOutcome outcome = orchestrator.acquire(nominal, plan);
      logSummary(outcome);
      if (output.previewsEnabled()) {
        writePreviews(outcome);
      }

      Container container = assembler.assemble(outcome, config.schema());
      long bytes = output.writeContainer(container);
      metrics.observe("container.bytes", bytes);
      metrics.observe("container.records", container.imageCount());
      output.writeTimestamp(outcome.canonicalTimestamp());
      log.info("Wrote {} record(s), {} bytes to {} (canonical {})",
          container.imageCount(), bytes, config.out(), CaptureTimestamps.formatHeader(container.timestamp()));
      return new AcquireReport(outcome, container, bytes);
    } finally {
      if (previousRun == null) {
        MDC.remove(MDC_RUN);
      } else {
        MDC.put(MDC_RUN, previousRun);
      }
    }
  }

  private static void logSummary(AcquisitionOutcome outcome) {
    Instant canonical = outcome.canonicalTimestamp();
    log.info("Canonical timestamp {} from {} channel(s)", canonical, outcome.successfulResults().size());
    for (ChannelResult result : outcome.successfulResults()) {
      long deltaMillis = Duration.between(canonical, result.actualTimestamp()).toMillis();
      log.info("  channel {}: captured {} ({}{} ms)",
          result.channelId(), result.actualTimestamp(), deltaMillis >= 0 ? "+" : "", deltaMillis);
    }
    for (ChannelFailure failure : outcome.failures()) {
      log.warn("  channel {}: missing ({} {})", failure.channelId(), failure.kind(), failure.message());
    }
  }

  private void writePreviews(AcquisitionOutcome outcome) {
    NormalizationPolicy policy = config.normalizationPolicy();
    for (ChannelResult result : outcome.successfulResults()) {
      try {
        output.writePreview(result.channelId(), result.actualTimestamp(), previewBytes(result, policy));
      } catch (IOException | RuntimeException ex) {
        log.warn("Preview for channel {} not written: {}", result.channelId(), ex.getMessage(), ex);
      }
    }
  }

  private byte[] previewBytes(ChannelResult result, NormalizationPolicy policy) throws IOException {
    if (policy.color() == ColorPolicy.ENCODED) {
      if (PREVIEW_FORMAT.equals(policy.encodedFormat())) {
        return result.buffer();
      }
      return codec.encode(codec.decodeGray(result.buffer()), PREVIEW_FORMAT);
    }
    return codec.encode(new GrayRaster(result.width(), result.height(), result.buffer()), PREVIEW_FORMAT);
  }
}
