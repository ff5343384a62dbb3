package ca.gc.cra.helio.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateWritableFileRejectsExistingFileWithoutAllowOverwrite() throws IOException {
    Path file = Files.writeString(tempDir.resolve("solar.dat"), "x");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableFile(file, false, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(file.toAbsolutePath().normalize(), Paths.validateWritableFile(file, false, true));
  }

  @Test
  void validateWritableFileCreatesParentsOnlyWhenRequested() {
    Path file = tempDir.resolve("a/b/solar.dat");

    Paths.validateWritableFile(file, false, false);
    assertFalse(Files.exists(file.getParent()), "dry-run validation should not create parents");

    Paths.validateWritableFile(file, true, false);
    assertTrue(Files.isDirectory(file.getParent()));
  }

  @Test
  void validateWritableFileRejectsDirectory() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(tempDir, true, true));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() throws IOException {
    Path dir = tempDir.resolve("previews");

    Path validated = Paths.validateWritableDir(dir, true);
    assertTrue(Files.isDirectory(validated));
    assertEquals(dir.toRealPath(), validated);
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, false));
  }
}
