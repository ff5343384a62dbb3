package ca.gc.cra.helio.infrastructure.container;

import ca.gc.cra.helio.domain.container.CompositeRecord;
import ca.gc.cra.helio.domain.container.CompressedRecord;
import ca.gc.cra.helio.domain.container.Container;
import ca.gc.cra.helio.domain.container.ContainerSchema;
import ca.gc.cra.helio.domain.container.ImageRecord;
import ca.gc.cra.helio.domain.container.PlaneRecord;
import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import java.io.EOFException;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Byte layout of the HELIO container file.
 *
 * <pre>
 * header     u8 count | 19 ASCII bytes "yyyy-MM-dd HH:mm:ss" (UTC)
 * RAW        u8 channelId | u16 width | u16 height | width*height bytes
 * COMPOSITE  u16 width | u16 height | width*height*3 bytes (RGB interleaved)
 * COMPRESSED u8 channelId | u32 length | length bytes
 * </pre>
 *
 * <p>Integers are little-endian. The file carries no magic or version, so the reader supplies the schema.</p>
 *
 * @since 0.1.0
 */
public final class ContainerCodec {
  private static final long MAX_U32 = 0xFFFF_FFFFL;

  private ContainerCodec() {}

  /**
   * Serializes a container.
   *
   * @param container container to write
   * @return container bytes
   * @throws IllegalArgumentException if a value does not fit its field or the container exceeds 2 GiB
   */
  public static byte[] encode(Container container) {
    Objects.requireNonNull(container, "container");
    if (container.imageCount() > 0xFF) {
      throw new IllegalArgumentException("record count exceeds 255: " + container.imageCount());
    }
    long length = container.serializedLength();
    if (length > Integer.MAX_VALUE - 8) {
      throw new IllegalArgumentException("container too large: " + length + " bytes");
    }
    ByteBuffer buf = ByteBuffer.allocate((int) length).order(ByteOrder.LITTLE_ENDIAN);
    buf.put((byte) container.imageCount());
    buf.put(CaptureTimestamps.headerBytes(container.timestamp()));
    for (ImageRecord record : container.records()) {
      if (record instanceof PlaneRecord plane) {
        putU8(buf, plane.channelId(), "channelId");
        putU16(buf, plane.width(), "width");
        putU16(buf, plane.height(), "height");
        buf.put(plane.pixels());
      } else if (record instanceof CompositeRecord composite) {
        putU16(buf, composite.width(), "width");
        putU16(buf, composite.height(), "height");
        buf.put(composite.rgb());
      } else if (record instanceof CompressedRecord compressed) {
        putU8(buf, compressed.channelId(), "channelId");
        buf.putInt((int) (compressed.byteLength() & MAX_U32));
        buf.put(compressed.data());
      }
    }
    return buf.array();
  }

  /**
   * Parses container bytes written with the given schema.
   *
   * @param bytes container bytes
   * @param schema schema the file was written with
   * @return parsed container
   * @throws EOFException if the data ends before the declared records do
   * @throws IOException if the header is malformed or bytes remain after the last record
   */
  public static Container decode(byte[] bytes, ContainerSchema schema) throws IOException {
    Objects.requireNonNull(bytes, "bytes");
    Objects.requireNonNull(schema, "schema");
    ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    try {
      int count = Byte.toUnsignedInt(buf.get());
      byte[] header = new byte[CaptureTimestamps.HEADER_LENGTH];
      buf.get(header);
      Container container;
      try {
        container = new Container(schema, CaptureTimestamps.parseHeader(new String(header, StandardCharsets.US_ASCII)),
            readRecords(buf, schema, count));
      } catch (DateTimeException ex) {
        throw new IOException("malformed container timestamp header", ex);
      }
      if (buf.hasRemaining()) {
        throw new IOException(buf.remaining() + " trailing byte(s) after " + count + " record(s)");
      }
      return container;
    } catch (BufferUnderflowException ex) {
      EOFException eof = new EOFException("container truncated at offset " + buf.position());
      eof.initCause(ex);
      throw eof;
    }
  }

  private static List<ImageRecord> readRecords(ByteBuffer buf, ContainerSchema schema, int count) {
    List<ImageRecord> records = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      records.add(switch (schema) {
        case RAW -> {
          int channelId = Byte.toUnsignedInt(buf.get());
          int width = Short.toUnsignedInt(buf.getShort());
          int height = Short.toUnsignedInt(buf.getShort());
          yield new PlaneRecord(channelId, width, height, take(buf, (long) width * height));
        }
        case COMPOSITE -> {
          int width = Short.toUnsignedInt(buf.getShort());
          int height = Short.toUnsignedInt(buf.getShort());
          yield new CompositeRecord(width, height, take(buf, (long) width * height * 3));
        }
        case COMPRESSED -> {
          int channelId = Byte.toUnsignedInt(buf.get());
          long length = Integer.toUnsignedLong(buf.getInt());
          yield new CompressedRecord(channelId, take(buf, length));
        }
      });
    }
    return records;
  }

  private static byte[] take(ByteBuffer buf, long length) {
    if (length > buf.remaining()) {
      throw new BufferUnderflowException();
    }
    byte[] out = new byte[(int) length];
    buf.get(out);
    return out;
  }

  private static void putU8(ByteBuffer buf, int value, String field) {
    if (value < 0 || value > 0xFF) {
      throw new IllegalArgumentException(field + " does not fit in u8: " + value);
    }
    buf.put((byte) value);
  }

  private static void putU16(ByteBuffer buf, int value, String field) {
    if (value < 0 || value > 0xFFFF) {
      throw new IllegalArgumentException(field + " does not fit in u16: " + value);
    }
    buf.putShort((short) value);
  }
}
