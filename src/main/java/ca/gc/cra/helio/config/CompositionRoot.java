package ca.gc.cra.helio.config;

import ca.gc.cra.helio.application.pipeline.AcquireUseCase;
import ca.gc.cra.helio.application.pipeline.AcquisitionOrchestrator;
import ca.gc.cra.helio.application.pipeline.ChannelFetcher;
import ca.gc.cra.helio.application.pipeline.ContainerAssembler;
import ca.gc.cra.helio.application.pipeline.FetchingChannelAcquirer;
import ca.gc.cra.helio.application.pipeline.RasterNormalizer;
import ca.gc.cra.helio.application.pipeline.WaveExecutor;
import ca.gc.cra.helio.application.port.ChannelSourcePort;
import ca.gc.cra.helio.application.port.ClockPort;
import ca.gc.cra.helio.application.port.ContainerOutputPort;
import ca.gc.cra.helio.application.port.MetricsPort;
import ca.gc.cra.helio.application.port.RasterCodecPort;
import ca.gc.cra.helio.infrastructure.container.FileContainerOutputAdapter;
import ca.gc.cra.helio.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.helio.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.helio.infrastructure.raster.ImageIoRasterCodec;
import ca.gc.cra.helio.infrastructure.source.OkHttpChannelSource;
import ca.gc.cra.helio.infrastructure.time.SystemClockAdapter;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the acquire use case to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the CLI and tests differ only in the ports
 * they pass in.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter; {@link #close()} flushes it.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.helio.application.pipeline.AcquireUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final AcquireConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root using the metrics exporter named by {@code metricsExporter} and the system clock.
   *
   * @param config acquire configuration
   * @param metricsExporter {@code otlp} or {@code none}
   */
  public CompositionRoot(AcquireConfig config, String metricsExporter) {
    this(config, metricsFor(metricsExporter), new SystemClockAdapter());
  }

  /**
   * Creates a root with explicit metrics and clock, typically from tests.
   *
   * @param config acquire configuration
   * @param metrics metrics adapter
   * @param clock clock
   */
  public CompositionRoot(AcquireConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the use case over the HTTP source, ImageIO codec, and file output.
   *
   * @return acquire use case
   */
  public AcquireUseCase acquireUseCase() {
    return acquireUseCase(channelSource(), rasterCodec(), containerOutput());
  }

  /**
   * Builds the use case over the supplied ports.
   *
   * @param source channel source
   * @param codec raster codec
   * @param output container output
   * @return acquire use case
   */
  public AcquireUseCase acquireUseCase(ChannelSourcePort source, RasterCodecPort codec, ContainerOutputPort output) {
    ChannelFetcher fetcher = new ChannelFetcher(source, config.timestampPrecision());
    RasterNormalizer normalizer = new RasterNormalizer(codec, config.normalizationPolicy());
    WaveExecutor waves = new WaveExecutor(
        new FetchingChannelAcquirer(fetcher, normalizer), config.maxConcurrency(), metrics);
    ContainerAssembler assembler = new ContainerAssembler(
        config.expectedChannels(), config.compositeFillMissing(), config.compositeChannels());
    return new AcquireUseCase(
        config, new AcquisitionOrchestrator(waves), assembler, codec, output, clock, metrics);
  }

  /**
   * HTTP channel source configured from {@code sourceUrl} and the transport timeouts.
   *
   * @return channel source
   */
  public ChannelSourcePort channelSource() {
    return new OkHttpChannelSource(
        config.sourceUrl(),
        Duration.ofMillis(config.connectTimeoutMillis()),
        Duration.ofMillis(config.readTimeoutMillis()));
  }

  /**
   * ImageIO-backed raster codec.
   *
   * @return raster codec
   */
  public RasterCodecPort rasterCodec() {
    return new ImageIoRasterCodec();
  }

  /**
   * File output for the container, sidecar, and previews.
   *
   * @return container output
   */
  public ContainerOutputPort containerOutput() {
    return new FileContainerOutputAdapter(config.out(), config.timestampOut(), config.debugDir());
  }

  /**
   * Supplies the metrics implementation used by the use case.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }

  static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "otlp" : exporter.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("none")) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter();
  }
}
