package ca.gc.cra.helio.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helio.config.AcquireConfig;
import ca.gc.cra.helio.config.CompositionRoot;
import ca.gc.cra.helio.domain.acquire.AcquisitionException;
import ca.gc.cra.helio.domain.container.AssemblyException;
import ca.gc.cra.helio.domain.container.CompositeRecord;
import ca.gc.cra.helio.domain.container.PlaneRecord;
import ca.gc.cra.helio.testutil.FakeRasterCodec;
import ca.gc.cra.helio.testutil.MemoryContainerOutput;
import ca.gc.cra.helio.testutil.RecordingMetrics;
import ca.gc.cra.helio.testutil.ScriptedChannelSource;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class AcquireUseCaseTest {
  private static final Instant CLOCK = Instant.parse("2025-12-30T14:00:00.750Z");

  @TempDir Path tempDir;

  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void independentRawRunWritesContainerThenTimestamp() throws Exception {
    ScriptedChannelSource source = new ScriptedChannelSource()
        .respond(9, FakeRasterCodec.image(8, 8, 9), "2025_12_30__13_59_54_340__SDO_AIA_AIA_94.jp2")
        .respond(11, FakeRasterCodec.image(8, 8, 11), "2025_12_30__13_59_57_120__SDO_AIA_AIA_335.jp2");
    MemoryContainerOutput output = new MemoryContainerOutput(false);
    AcquireUseCase useCase = useCase(config(Map.of(
        "schema", "RAW", "mode", "INDEPENDENT", "channels", "9,10,11", "resample", "SCALE", "scaleFactor", "0.5")),
        source, output);

    AcquireReport report = useCase.run();

    assertEquals(Instant.parse("2025-12-30T13:59:57Z"), report.outcome().canonicalTimestamp());
    assertEquals(2, output.container().imageCount());
    PlaneRecord first = (PlaneRecord) output.container().records().get(0);
    assertEquals(4, first.width());
    assertEquals(List.of("container", "timestamp"), output.writeOrder());
    assertEquals(report.outcome().canonicalTimestamp(), output.timestamp());
    assertEquals(1, report.outcome().failures().size());
    assertEquals(List.of(report.bytesWritten()), metrics.observed("container.bytes"));
    assertTrue(source.requests().stream().allMatch(r -> r.nominalTimestamp().equals(CLOCK.minusMillis(750))),
        "nominal timestamp is the clock truncated to seconds");
    assertNull(MDC.get(AcquireUseCase.MDC_RUN));
  }

  @Test
  void anchoredCompositeUsesReferenceCapture() throws Exception {
    ScriptedChannelSource source = new ScriptedChannelSource();
    for (int channel : new int[] {9, 10, 11, 13, 16}) {
      source.respond(channel, FakeRasterCodec.image(8, 8, channel), null);
    }
    source.respond(19, FakeRasterCodec.image(8, 8, 19), "2025_12_30__13_59_50__SDO_AIA_AIA_1600.jp2");
    MemoryContainerOutput output = new MemoryContainerOutput(true);
    AcquireUseCase useCase = useCase(config(Map.of("targetWidth", "4", "targetHeight", "4")), source, output);

    AcquireReport report = useCase.run();

    Instant anchor = Instant.parse("2025-12-30T13:59:50Z");
    assertEquals(anchor, report.container().timestamp());
    assertEquals(2, report.container().imageCount());
    CompositeRecord high = (CompositeRecord) report.container().records().get(1);
    assertEquals(13, high.rgb()[0]);
    assertEquals(19, high.rgb()[2]);
    assertEquals(6, output.previews().size());
    assertTrue(source.requests().stream().filter(r -> r.channelId() != 19)
        .allMatch(r -> r.nominalTimestamp().equals(anchor)));
  }

  @Test
  void explicitTimestampOverridesClock() throws Exception {
    ScriptedChannelSource source = new ScriptedChannelSource().respond(4, FakeRasterCodec.image(2, 2, 1), null);
    AcquireUseCase useCase = useCase(config(Map.of(
        "schema", "COMPRESSED", "mode", "SINGLE", "channels", "4", "timestamp", "2024-05-01 00:00:00",
        "targetWidth", "2", "targetHeight", "2")),
        source, new MemoryContainerOutput(false));

    AcquireReport report = useCase.run();

    assertEquals(Instant.parse("2024-05-01T00:00:00Z"), report.outcome().canonicalTimestamp());
  }

  @Test
  void incompleteCompositeIsRefusedWithoutWriting() {
    ScriptedChannelSource source = new ScriptedChannelSource()
        .respond(19, FakeRasterCodec.image(4, 4, 19), null)
        .respond(9, FakeRasterCodec.image(4, 4, 9), null);
    MemoryContainerOutput output = new MemoryContainerOutput(false);
    AcquireUseCase useCase = useCase(config(Map.of("targetWidth", "4", "targetHeight", "4")), source, output);

    assertThrows(AssemblyException.class, useCase::run);
    assertTrue(output.writeOrder().isEmpty());
  }

  @Test
  void referenceFailureSurfacesAsAcquisitionFailure() {
    ScriptedChannelSource source = new ScriptedChannelSource().fail(19, "HTTP 500 from test");
    MemoryContainerOutput output = new MemoryContainerOutput(false);

    assertThrows(AcquisitionException.class, () -> useCase(config(Map.of()), source, output).run());
    assertEquals(1, source.requests().size());
  }

  @Test
  void containerWriteFailureSkipsTimestamp() {
    ScriptedChannelSource source = new ScriptedChannelSource().respond(4, FakeRasterCodec.image(2, 2, 1), null);
    MemoryContainerOutput output = new MemoryContainerOutput(false).failContainerWrites(new IOException("disk full"));
    AcquireUseCase useCase = useCase(config(Map.of(
        "schema", "RAW", "mode", "SINGLE", "channels", "4", "resample", "SCALE", "scaleFactor", "1.0")),
        source, output);

    assertThrows(IOException.class, useCase::run);
    assertNull(output.timestamp());
  }

  private AcquireConfig config(Map<String, String> overrides) {
    Map<String, String> options = new HashMap<>(overrides);
    options.put("out", tempDir.resolve("solar.dat").toString());
    return AcquireConfig.fromMap(options);
  }

  private AcquireUseCase useCase(AcquireConfig config, ScriptedChannelSource source, MemoryContainerOutput output) {
    CompositionRoot root = new CompositionRoot(config, metrics, () -> CLOCK);
    return root.acquireUseCase(source, new FakeRasterCodec(), output);
  }
}
