package ca.gc.cra.helio.domain.container;

import java.util.Arrays;
import java.util.Objects;

/**
 * Compressed-schema record: an opaque encoded image prefixed by its byte length.
 *
 * @param channelId source channel identifier
 * @param data encoded image bytes; copied on construction
 * @since 0.1.0
 */
public record CompressedRecord(int channelId, byte[] data) implements ImageRecord {
  /** Field prefix: channel id (1), byte length (4). */
  public static final int PREFIX_LENGTH = 5;

  public CompressedRecord {
    data = Objects.requireNonNull(data, "data").clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  /**
   * Returns the length written in the record's length field.
   *
   * @return encoded byte length
   */
  public int byteLength() {
    return data.length;
  }

  @Override
  public long serializedLength() {
    return PREFIX_LENGTH + (long) data.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof CompressedRecord that
        && channelId == that.channelId
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * Integer.hashCode(channelId) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "CompressedRecord{channelId=" + channelId + ", bytes=" + data.length + '}';
  }
}
