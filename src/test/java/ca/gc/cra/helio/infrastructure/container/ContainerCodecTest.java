package ca.gc.cra.helio.infrastructure.container;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.helio.domain.container.CompositeRecord;
import ca.gc.cra.helio.domain.container.CompressedRecord;
import ca.gc.cra.helio.domain.container.Container;
import ca.gc.cra.helio.domain.container.ContainerSchema;
import ca.gc.cra.helio.domain.container.PlaneRecord;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContainerCodecTest {
  private static final Instant TS = Instant.parse("2025-12-30T13:59:55Z");

  @Test
  void rawLayoutIsLittleEndianWithAsciiHeader() {
    Container container = new Container(ContainerSchema.RAW, TS,
        List.of(new PlaneRecord(9, 0x0102, 1, new byte[0x0102])));

    byte[] bytes = ContainerCodec.encode(container);

    assertEquals(1, bytes[0]);
    assertEquals("2025-12-30 13:59:55", new String(bytes, 1, 19, StandardCharsets.US_ASCII));
    assertEquals(9, bytes[20]);
    assertArrayEquals(new byte[] {0x02, 0x01, 0x01, 0x00}, Arrays.copyOfRange(bytes, 21, 25));
    assertEquals(25 + 0x0102, bytes.length);
  }

  @Test
  void compressedLengthIsUnsigned32Bit() {
    Container container = new Container(ContainerSchema.COMPRESSED, TS,
        List.of(new CompressedRecord(16, new byte[] {7, 7, 7})));

    byte[] bytes = ContainerCodec.encode(container);

    assertEquals(16, bytes[20]);
    assertArrayEquals(new byte[] {3, 0, 0, 0}, Arrays.copyOfRange(bytes, 21, 25));
    assertEquals(28, bytes.length);
  }

  @Test
  void rawRecordsDecodeBitForBit() throws IOException {
    PlaneRecord wide = new PlaneRecord(200, 30, 20, pattern(600, 7));
    PlaneRecord small = new PlaneRecord(9, 3, 2, pattern(6, 131));
    PlaneRecord top = new PlaneRecord(255, 1, 1, new byte[] {(byte) 0xFF});
    Container container = new Container(ContainerSchema.RAW, TS, List.of(wide, small, top));

    Container decoded = ContainerCodec.decode(ContainerCodec.encode(container), ContainerSchema.RAW);

    assertEquals(3, decoded.imageCount());
    assertEquals(TS, decoded.timestamp());
    for (int i = 0; i < 3; i++) {
      PlaneRecord expected = (PlaneRecord) container.records().get(i);
      PlaneRecord actual = (PlaneRecord) decoded.records().get(i);
      assertEquals(expected.channelId(), actual.channelId());
      assertEquals(expected.width() * expected.height(), actual.pixels().length);
      assertArrayEquals(expected.pixels(), actual.pixels());
    }
  }

  @Test
  void compressedRecordsDecodeBitForBit() throws IOException {
    CompressedRecord first = new CompressedRecord(171, pattern(1_000, 3));
    CompressedRecord empty = new CompressedRecord(16, new byte[0]);
    CompressedRecord last = new CompressedRecord(211, pattern(17, 250));
    Container container = new Container(ContainerSchema.COMPRESSED, TS, List.of(first, empty, last));

    Container decoded = ContainerCodec.decode(ContainerCodec.encode(container), ContainerSchema.COMPRESSED);

    assertEquals(container.imageCount(), decoded.imageCount());
    for (int i = 0; i < container.imageCount(); i++) {
      CompressedRecord expected = (CompressedRecord) container.records().get(i);
      CompressedRecord actual = (CompressedRecord) decoded.records().get(i);
      assertEquals(expected.channelId(), actual.channelId());
      assertArrayEquals(expected.data(), actual.data());
    }
  }

  @Test
  void decodeReadsBackCompositeContainer() throws IOException {
    byte[] rgb = new byte[2 * 2 * 3];
    Arrays.fill(rgb, (byte) 0x7F);
    Container container = new Container(ContainerSchema.COMPOSITE, TS,
        List.of(new CompositeRecord(2, 2, rgb), new CompositeRecord(2, 2, new byte[12])));

    Container decoded = ContainerCodec.decode(ContainerCodec.encode(container), ContainerSchema.COMPOSITE);

    assertEquals(container, decoded);
  }

  @Test
  void decodeRejectsTruncatedAndTrailingBytes() {
    Container container = new Container(ContainerSchema.RAW, TS, List.of(new PlaneRecord(9, 2, 2, new byte[4])));
    byte[] bytes = ContainerCodec.encode(container);

    assertThrows(EOFException.class,
        () -> ContainerCodec.decode(Arrays.copyOf(bytes, bytes.length - 1), ContainerSchema.RAW));
    IOException trailing = assertThrows(IOException.class,
        () -> ContainerCodec.decode(Arrays.copyOf(bytes, bytes.length + 2), ContainerSchema.RAW));
    assertEquals("2 trailing byte(s) after 1 record(s)", trailing.getMessage());
  }

  @Test
  void decodeRejectsMalformedHeader() {
    byte[] bytes = new byte[20];
    Arrays.fill(bytes, (byte) 'x');
    bytes[0] = 0;

    assertThrows(IOException.class, () -> ContainerCodec.decode(bytes, ContainerSchema.RAW));
  }

  @Test
  void encodeRejectsOversizedDimensions() {
    Container container = new Container(ContainerSchema.RAW, TS,
        List.of(new PlaneRecord(9, 70_000, 1, new byte[70_000])));

    assertThrows(IllegalArgumentException.class, () -> ContainerCodec.encode(container));
  }

  private static byte[] pattern(int length, int seed) {
    byte[] bytes = new byte[length];
    for (int i = 0; i < length; i++) {
      bytes[i] = (byte) (seed + i * 37);
    }
    return bytes;
  }
}
