package ca.gc.cra.helio.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import ca.gc.cra.helio.application.port.MetricsPort;
import ca.gc.cra.helio.infrastructure.container.FileContainerOutputAdapter;
import ca.gc.cra.helio.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.helio.infrastructure.raster.ImageIoRasterCodec;
import ca.gc.cra.helio.infrastructure.source.OkHttpChannelSource;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  @TempDir Path tempDir;

  @Test
  void exporterNoneUsesNoOpMetrics() {
    MetricsPort metrics = CompositionRoot.metricsFor(" NONE ");

    assertInstanceOf(NoOpMetricsAdapter.class, metrics);
  }

  @Test
  void defaultWiringUsesHttpImageIoAndFileAdapters() {
    AcquireConfig config = AcquireConfig.fromMap(Map.of("out", tempDir.resolve("solar.dat").toString()));
    try (CompositionRoot root = new CompositionRoot(config, "none")) {
      assertInstanceOf(OkHttpChannelSource.class, root.channelSource());
      assertInstanceOf(ImageIoRasterCodec.class, root.rasterCodec());
      assertInstanceOf(FileContainerOutputAdapter.class, root.containerOutput());
      assertFalse(root.containerOutput().previewsEnabled());
      assertNotNull(root.acquireUseCase());
    }
  }
}
