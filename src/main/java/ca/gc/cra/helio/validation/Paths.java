package ca.gc.cra.helio.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for HELIO CLI and configuration flows.
 * <p><strong>Why:</strong> Ensures the container file, sidecar file, and preview directory land in writable
 * locations and that an existing container is only replaced when the operator asks for it.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked destination is never followed.
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates the destination of a single output file.
   *
   * @param path candidate file path; must not be {@code null}
   * @param createParents whether to create missing parent directories
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a directory, exists without {@code allowOverwrite},
   *     or its parent is not writable
   */
  public static Path validateWritableFile(Path path, boolean createParents, boolean allowOverwrite) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        if (!createParents) {
          ensureWritable(nearestExistingAncestor(parent));
          return normalized;
        }
        Files.createDirectories(parent);
      }
      ensureWritable(parent.toRealPath(LinkOption.NOFOLLOW_LINKS));
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate file " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a writable directory, optionally creating it when missing.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return canonical directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
          throw new IllegalArgumentException("path is not a directory: " + real);
        }
        ensureWritable(real);
        return real;
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        return normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      }
      ensureWritable(nearestExistingAncestor(normalized));
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureWritable(Path dir) {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("parent is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }
}
