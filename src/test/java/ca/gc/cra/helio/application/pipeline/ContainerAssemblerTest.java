package ca.gc.cra.helio.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helio.domain.acquire.AcquisitionOutcome;
import ca.gc.cra.helio.domain.acquire.ChannelFailure;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import ca.gc.cra.helio.domain.container.AssemblyException;
import ca.gc.cra.helio.domain.container.CompositeRecord;
import ca.gc.cra.helio.domain.container.CompressedRecord;
import ca.gc.cra.helio.domain.container.Container;
import ca.gc.cra.helio.domain.container.ContainerSchema;
import ca.gc.cra.helio.domain.container.PlaneRecord;
import ca.gc.cra.helio.infrastructure.container.ContainerCodec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContainerAssemblerTest {
  private static final Instant CANONICAL = Instant.parse("2025-12-30T13:59:55.480Z");

  @Test
  void rawKeepsArrivalOrderAndSkipsFailedChannel() throws Exception {
    AcquisitionOutcome outcome = new AcquisitionOutcome(CANONICAL,
        List.of(plane(11, 4, 2), plane(9, 4, 2)),
        List.of(new ChannelFailure(10, ChannelFailure.Kind.TRANSPORT, "HTTP 404")));

    Container container = ContainerAssembler.strict().assemble(outcome, ContainerSchema.RAW);

    assertEquals(2, container.imageCount());
    assertEquals(Instant.parse("2025-12-30T13:59:55Z"), container.timestamp());
    PlaneRecord first = (PlaneRecord) container.records().get(0);
    assertEquals(11, first.channelId());
    assertEquals(4, first.width());
    assertEquals(8, first.pixels().length);
    assertEquals(20 + 2 * (5 + 8), container.serializedLength());
  }

  @Test
  void compositeSortsByChannelAndInterleavesTriplets() throws Exception {
    List<ChannelResult> arrival = List.of(
        plane(10, 2, 2), plane(9, 2, 2), plane(13, 2, 2), plane(11, 2, 2), plane(19, 2, 2), plane(16, 2, 2));

    Container container = ContainerAssembler.strict()
        .assemble(AcquisitionOutcome.of(CANONICAL, arrival), ContainerSchema.COMPOSITE);

    assertEquals(2, container.imageCount());
    CompositeRecord low = (CompositeRecord) container.records().get(0);
    CompositeRecord high = (CompositeRecord) container.records().get(1);
    assertEquals(2, low.width());
    assertEquals(12, low.rgb().length);
    assertArrayEquals(new byte[] {9, 10, 11}, Arrays.copyOfRange(low.rgb(), 0, 3));
    assertArrayEquals(new byte[] {9, 10, 11}, Arrays.copyOfRange(low.rgb(), 9, 12));
    assertArrayEquals(new byte[] {13, 16, 19}, Arrays.copyOfRange(high.rgb(), 3, 6));
  }

  @Test
  void compositeRejectsIncompleteBatchWithoutFill() {
    List<ChannelResult> five = List.of(
        plane(9, 2, 2), plane(10, 2, 2), plane(11, 2, 2), plane(13, 2, 2), plane(16, 2, 2));

    AssemblyException ex = assertThrows(AssemblyException.class, () -> ContainerAssembler.strict()
        .assemble(AcquisitionOutcome.of(CANONICAL, five), ContainerSchema.COMPOSITE));
    assertEquals("composite requires exactly 6 channels (acquired 5)", ex.getMessage());
  }

  @Test
  void compositeRejectsMismatchedPlanes() {
    List<ChannelResult> results = List.of(plane(9, 2, 2), plane(10, 2, 2), plane(11, 3, 2));

    AssemblyException ex = assertThrows(AssemblyException.class, () -> new ContainerAssembler(3, false, List.of())
        .assemble(AcquisitionOutcome.of(CANONICAL, results), ContainerSchema.COMPOSITE));
    assertTrue(ex.getMessage().startsWith("channel length mismatch"));
  }

  @Test
  void fillSubstitutesBlackPlaneForMissingChannel() throws Exception {
    ContainerAssembler assembler = new ContainerAssembler(3, true, List.of(9, 10, 11));
    List<ChannelResult> results = List.of(plane(11, 2, 1), plane(9, 2, 1));

    Container container = assembler.assemble(AcquisitionOutcome.of(CANONICAL, results), ContainerSchema.COMPOSITE);

    CompositeRecord record = (CompositeRecord) container.records().get(0);
    assertArrayEquals(new byte[] {9, 0, 11, 9, 0, 11}, record.rgb());
  }

  @Test
  void compressedRecordsCarryEncodedLength() throws Exception {
    ChannelResult encoded = new ChannelResult(9, CANONICAL, new byte[] {1, 2, 3, 4, 5}, 64, 64);

    Container container = ContainerAssembler.strict()
        .assemble(AcquisitionOutcome.of(CANONICAL, List.of(encoded)), ContainerSchema.COMPRESSED);

    CompressedRecord record = (CompressedRecord) container.records().get(0);
    assertEquals(9, record.channelId());
    assertEquals(5, record.byteLength());
  }

  @Test
  void assemblingTwiceYieldsIdenticalBytes() throws Exception {
    AcquisitionOutcome outcome = AcquisitionOutcome.of(CANONICAL, List.of(plane(9, 3, 3), plane(10, 3, 3)));
    ContainerAssembler assembler = ContainerAssembler.strict();

    for (ContainerSchema schema : List.of(ContainerSchema.RAW, ContainerSchema.COMPRESSED)) {
      assertArrayEquals(ContainerCodec.encode(assembler.assemble(outcome, schema)),
          ContainerCodec.encode(assembler.assemble(outcome, schema)), schema.name());
    }
  }

  @Test
  void recordCountAndDimensionLimitsAreEnforced() {
    List<ChannelResult> many = new ArrayList<>();
    for (int i = 0; i < 256; i++) {
      many.add(new ChannelResult(i % 256, CANONICAL, new byte[1], 1, 1));
    }
    assertThrows(AssemblyException.class, () -> ContainerAssembler.strict()
        .assemble(AcquisitionOutcome.of(CANONICAL, many), ContainerSchema.RAW));

    ChannelResult wide = new ChannelResult(9, CANONICAL, new byte[65_536], 65_536, 1);
    assertThrows(AssemblyException.class, () -> ContainerAssembler.strict()
        .assemble(AcquisitionOutcome.of(CANONICAL, List.of(wide)), ContainerSchema.RAW));
  }

  private static ChannelResult plane(int channelId, int width, int height) {
    byte[] pixels = new byte[width * height];
    Arrays.fill(pixels, (byte) channelId);
    return new ChannelResult(channelId, CANONICAL, pixels, width, height);
  }
}
