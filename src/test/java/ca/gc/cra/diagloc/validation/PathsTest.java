package ca.gc.cra.diagloc.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
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
  void requireReadableFileAcceptsExistingFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("fr.yaml"), "[]");

    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("in", file));
  }

  @Test
  void requireReadableFileRejectsMissingAndDirectories() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir.resolve("missing.yaml")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir));
  }

  @Test
  void prepareOutputFileCreatesParents() {
    Path target = tempDir.resolve("nested/deeper/fr.db");

    Path prepared = Paths.prepareOutputFile("out", target, false);

    assertTrue(Files.isDirectory(prepared.getParent()));
  }

  @Test
  void prepareOutputFileHonoursOverwriteFlag() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("en.yaml"), "old");

    assertThrows(IllegalArgumentException.class, () -> Paths.prepareOutputFile("out", existing, false));
    assertEquals(existing.toAbsolutePath().normalize(), Paths.prepareOutputFile("out", existing, true));
  }

  @Test
  void prepareOutputFileRejectsDirectory() {
    assertThrows(IllegalArgumentException.class, () -> Paths.prepareOutputFile("out", tempDir, true));
  }
}
