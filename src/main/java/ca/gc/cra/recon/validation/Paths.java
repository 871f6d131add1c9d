package ca.gc.cra.recon.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for database directories and input files.
 * <p><strong>Why:</strong> The JSON-file store writes through on every change; catching an unwritable
 * directory up front turns a mid-load failure into a configuration error.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results may be invalidated by concurrent filesystem changes.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked directory resolves to its real path
 * only through {@link Path#toRealPath}.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a database directory.
   *
   * @param path candidate directory
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return real path of the directory, or the normalized absolute path when it does not exist yet
   * @throws IllegalArgumentException if the path is not a writable directory or cannot be created
   */
  public static Path validateDatabaseDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("database directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a readable regular file.
   *
   * @param path candidate file
   * @return normalized absolute path
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
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
}
