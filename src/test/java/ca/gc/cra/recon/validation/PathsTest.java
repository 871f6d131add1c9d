package ca.gc.cra.recon.validation;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir
  Path tempDir;

  @Test
  void databaseDirectoryIsCreatedOnlyWhenAllowed() {
    Path db = tempDir.resolve("db");
    assertThrows(IllegalArgumentException.class, () -> Paths.validateDatabaseDir(db, false));
    Path created = Paths.validateDatabaseDir(db, true);
    assertTrue(Files.isDirectory(created));
    assertEquals(created, Paths.validateDatabaseDir(db, false));
  }

  @Test
  void regularFileIsNotADatabaseDirectory() throws Exception {
    Path file = Files.writeString(tempDir.resolve("hosts.json"), "[]");
    assertThrows(IllegalArgumentException.class, () -> Paths.validateDatabaseDir(file, false));
    assertEquals(file.toAbsolutePath().normalize(), Paths.validateReadableFile(file));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir.resolve("missing")));
  }
}
