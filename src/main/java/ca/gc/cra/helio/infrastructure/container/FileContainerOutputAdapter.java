package ca.gc.cra.helio.infrastructure.container;

import ca.gc.cra.helio.application.port.ContainerOutputPort;
import ca.gc.cra.helio.domain.container.Container;
import ca.gc.cra.helio.domain.time.CaptureTimestamps;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes the container, sidecar timestamp, and previews to the local filesystem.
 * <p><strong>Why:</strong> Consumers poll the container path; every file is written to a sibling temp file and
 * moved into place so a reader sees either the previous file or the new one.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one adapter per run.</p>
 *
 * @since 0.1.0
 */
public final class FileContainerOutputAdapter implements ContainerOutputPort {
  private static final Logger log = LoggerFactory.getLogger(FileContainerOutputAdapter.class);

  private final Path containerPath;
  private final Optional<Path> timestampPath;
  private final Optional<Path> previewDir;

  /**
   * Creates the adapter.
   *
   * @param containerPath destination of the container file
   * @param timestampPath optional sidecar destination
   * @param previewDir optional preview directory
   */
  public FileContainerOutputAdapter(Path containerPath, Optional<Path> timestampPath, Optional<Path> previewDir) {
    this.containerPath = Objects.requireNonNull(containerPath, "containerPath");
    this.timestampPath = Objects.requireNonNull(timestampPath, "timestampPath");
    this.previewDir = Objects.requireNonNull(previewDir, "previewDir");
  }

  @Override
  public long writeContainer(Container container) throws IOException {
    byte[] bytes;
    try {
      bytes = ContainerCodec.encode(container);
    } catch (IllegalArgumentException ex) {
      throw new IOException("unable to serialize container: " + ex.getMessage(), ex);
    }
    writeAtomically(containerPath, bytes);
    return bytes.length;
  }

  @Override
  public void writeTimestamp(Instant canonicalTimestamp) throws IOException {
    if (timestampPath.isEmpty()) {
      return;
    }
    byte[] text = CaptureTimestamps.formatHeader(canonicalTimestamp).getBytes(StandardCharsets.US_ASCII);
    writeAtomically(timestampPath.get(), text);
    log.debug("Wrote timestamp sidecar {}", timestampPath.get());
  }

  @Override
  public void writePreview(int channelId, Instant timestamp, byte[] encodedImage) throws IOException {
    if (previewDir.isEmpty()) {
      return;
    }
    Path dir = previewDir.get();
    Files.createDirectories(dir);
    Path target = dir.resolve(channelId + "_" + CaptureTimestamps.formatCompact(timestamp) + ".png");
    writeAtomically(target, encodedImage);
    log.debug("Wrote preview {}", target);
  }

  @Override
  public boolean previewsEnabled() {
    return previewDir.isPresent();
  }

  static void writeAtomically(Path target, byte[] bytes) throws IOException {
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".tmp");
    try {
      Files.write(temp, bytes);
      try {
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; falling back to replace", absolute);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
