package ca.gc.cra.helio.domain.container;

import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> In-memory form of a HELIO container file.
 * <p><strong>Why:</strong> The whole container is built and validated before any byte reaches disk, so a failed
 * assembly never leaves a partial file.</p>
 * <p><strong>Role:</strong> Domain aggregate produced by the assembler and serialized by the container codec.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param schema layout of every record in {@link #records()}
 * @param timestamp canonical batch instant, written at second precision
 * @param records image records in output order
 * @since 0.1.0
 */
public record Container(ContainerSchema schema, Instant timestamp, List<ImageRecord> records) {
  /** Header length: record count (1) plus timestamp text (19). */
  public static final int HEADER_LENGTH = 1 + CaptureTimestamps.HEADER_LENGTH;

  public Container {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(timestamp, "timestamp");
    records = List.copyOf(Objects.requireNonNull(records, "records"));
  }

  /**
   * Returns the value written in the header count byte.
   *
   * @return number of records
   */
  public int imageCount() {
    return records.size();
  }

  /**
   * Returns the total serialized size, header included.
   *
   * @return container length in bytes
   */
  public long serializedLength() {
    long total = HEADER_LENGTH;
    for (ImageRecord record : records) {
      total += record.serializedLength();
    }
    return total;
  }
}
