package ca.gc.cra.helio.application.port;

import ca.gc.cra.helio.domain.container.Container;
import java.io.IOException;
import java.time.Instant;

/**
 * <strong>What:</strong> Port persisting an assembled container and its companion artifacts.
 * <p><strong>Why:</strong> Separates the container byte layout and atomic file replacement from the use case.</p>
 * <p><strong>Thread-safety:</strong> Called from the use case thread only.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.helio.infrastructure.container.FileContainerOutputAdapter
 */
public interface ContainerOutputPort {
  /**
   * Serializes and publishes the container; readers never observe a partially written file.
   *
   * @param container assembled container
   * @return number of bytes written
   * @throws IOException if writing or publishing fails
   */
  long writeContainer(Container container) throws IOException;

  /**
   * Writes the canonical timestamp to the sidecar file, if one is configured.
   *
   * @param canonicalTimestamp canonical capture instant
   * @throws IOException if writing fails
   */
  void writeTimestamp(Instant canonicalTimestamp) throws IOException;

  /**
   * Writes a preview image for one channel, if a preview directory is configured.
   *
   * @param channelId channel identifier
   * @param timestamp channel's actual capture instant
   * @param encodedImage encoded preview bytes (PNG)
   * @throws IOException if writing fails
   */
  void writePreview(int channelId, Instant timestamp, byte[] encodedImage) throws IOException;

  /**
   * Returns whether previews are written at all.
   *
   * @return {@code true} when a preview directory is configured
   */
  boolean previewsEnabled();
}
