package ca.gc.cra.helio.application.pipeline;

import ca.gc.cra.helio.domain.acquire.AcquisitionOutcome;
import ca.gc.cra.helio.domain.acquire.ChannelResult;
import ca.gc.cra.helio.domain.container.AssemblyException;
import ca.gc.cra.helio.domain.container.CompositeRecord;
import ca.gc.cra.helio.domain.container.CompressedRecord;
import ca.gc.cra.helio.domain.container.Container;
import ca.gc.cra.helio.domain.container.ContainerSchema;
import ca.gc.cra.helio.domain.container.ImageRecord;
import ca.gc.cra.helio.domain.container.PlaneRecord;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns an {@link AcquisitionOutcome} into a {@link Container} for the requested schema.
 * <p><strong>Role:</strong> Last pure step before serialization; the output is a deterministic function of the
 * outcome.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * <p>Composite images are built from channels sorted by id and grouped in threes; pixel {@code i} of a group
 * becomes bytes {@code 3i..3i+2}, one per member in ascending id order.</p>
 *
 * @since 0.1.0
 */
public final class ContainerAssembler {
  private static final Logger log = LoggerFactory.getLogger(ContainerAssembler.class);

  /** Largest record count the header byte can carry. */
  public static final int MAX_RECORDS = 0xFF;
  /** Largest width or height a record can carry. */
  public static final int MAX_DIMENSION = 0xFFFF;
  /** Channels per composite image. */
  public static final int GROUP_SIZE = 3;

  private final int expectedChannels;
  private final boolean fillMissing;
  private final List<Integer> compositeChannels;

  /**
   * Creates an assembler.
   *
   * @param expectedChannels composite cardinality; a positive multiple of {@link #GROUP_SIZE}
   * @param fillMissing whether absent {@code compositeChannels} are replaced with black planes
   * @param compositeChannels channels expected by fill mode
   */
  public ContainerAssembler(int expectedChannels, boolean fillMissing, List<Integer> compositeChannels) {
    if (expectedChannels <= 0 || expectedChannels % GROUP_SIZE != 0) {
      throw new IllegalArgumentException(
          "expectedChannels must be a positive multiple of " + GROUP_SIZE + " (was " + expectedChannels + ")");
    }
    this.expectedChannels = expectedChannels;
    this.fillMissing = fillMissing;
    this.compositeChannels = List.copyOf(Objects.requireNonNull(compositeChannels, "compositeChannels"));
  }

  /**
   * Assembler with the default six-channel composite and fill mode off.
   *
   * @return assembler
   */
  public static ContainerAssembler strict() {
    return new ContainerAssembler(6, false, List.of());
  }

  /**
   * Assembles the container.
   *
   * @param outcome acquisition outcome
   * @param schema output layout
   * @return container whose timestamp is the canonical instant at second precision
   * @throws AssemblyException on composite cardinality or length mismatch, or a value too large for its field
   */
  public Container assemble(AcquisitionOutcome outcome, ContainerSchema schema) throws AssemblyException {
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(schema, "schema");
    List<ImageRecord> records = switch (schema) {
      case RAW -> raw(outcome.successfulResults());
      case COMPOSITE -> composite(outcome.successfulResults());
      case COMPRESSED -> compressed(outcome.successfulResults());
    };
    if (records.size() > MAX_RECORDS) {
      throw new AssemblyException("record count " + records.size() + " exceeds " + MAX_RECORDS);
    }
    return new Container(schema, outcome.canonicalTimestamp().truncatedTo(ChronoUnit.SECONDS), records);
  }

  private static List<ImageRecord> raw(List<ChannelResult> results) throws AssemblyException {
    List<ImageRecord> records = new ArrayList<>(results.size());
    for (ChannelResult result : results) {
      requireDimensions(result.width(), result.height());
      if ((long) result.width() * result.height() != result.length()) {
        throw new AssemblyException("channel " + result.channelId() + ": plane length " + result.length()
            + " does not match " + result.width() + "x" + result.height());
      }
      records.add(new PlaneRecord(result.channelId(), result.width(), result.height(), result.buffer()));
    }
    return records;
  }

  private static List<ImageRecord> compressed(List<ChannelResult> results) {
    List<ImageRecord> records = new ArrayList<>(results.size());
    for (ChannelResult result : results) {
      records.add(new CompressedRecord(result.channelId(), result.buffer()));
    }
    return records;
  }

  private List<ImageRecord> composite(List<ChannelResult> results) throws AssemblyException {
    List<ChannelResult> members = new ArrayList<>(results);
    if (fillMissing) {
      fill(members);
    }
    if (members.size() != expectedChannels) {
      throw new AssemblyException(
          "composite requires exactly " + expectedChannels + " channels (acquired " + members.size() + ")");
    }
    members.sort(Comparator.comparingInt(ChannelResult::channelId));
    List<ImageRecord> records = new ArrayList<>(expectedChannels / GROUP_SIZE);
    for (int start = 0; start < members.size(); start += GROUP_SIZE) {
      records.add(interleave(members.subList(start, start + GROUP_SIZE)));
    }
    return records;
  }

  private void fill(List<ChannelResult> members) {
    ChannelResult template = members.get(0);
    Set<Integer> present = new HashSet<>();
    for (ChannelResult member : members) {
      present.add(member.channelId());
    }
    for (int channel : compositeChannels) {
      if (present.add(channel)) {
        log.warn("Channel {} missing from composite; substituting a black {}x{} plane",
            channel, template.width(), template.height());
        members.add(new ChannelResult(channel, template.actualTimestamp(),
            new byte[template.length()], template.width(), template.height()));
      }
    }
  }

  private static CompositeRecord interleave(List<ChannelResult> group) throws AssemblyException {
    ChannelResult first = group.get(0);
    for (ChannelResult member : group) {
      if (member.length() != first.length()
          || member.width() != first.width()
          || member.height() != first.height()) {
        throw new AssemblyException("channel length mismatch: channel " + member.channelId() + " has "
            + member.length() + " bytes, channel " + first.channelId() + " has " + first.length());
      }
    }
    requireDimensions(first.width(), first.height());
    int pixels = first.length();
    if ((long) first.width() * first.height() != pixels) {
      throw new AssemblyException("channel " + first.channelId() + ": plane length " + pixels
          + " does not match " + first.width() + "x" + first.height());
    }
    byte[] rgb = new byte[Math.multiplyExact(pixels, GROUP_SIZE)];
    for (int k = 0; k < GROUP_SIZE; k++) {
      byte[] plane = group.get(k).buffer();
      for (int i = 0; i < pixels; i++) {
        rgb[GROUP_SIZE * i + k] = plane[i];
      }
    }
    return new CompositeRecord(first.width(), first.height(), rgb);
  }

  private static void requireDimensions(int width, int height) throws AssemblyException {
    if (width > MAX_DIMENSION || height > MAX_DIMENSION) {
      throw new AssemblyException(
          "dimensions " + width + "x" + height + " exceed the " + MAX_DIMENSION + " field limit");
    }
  }
}
