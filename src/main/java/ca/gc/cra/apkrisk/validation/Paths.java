package ca.gc.cra.apkrisk.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem checks for job files, artifact directories, intelligence feeds and report outputs.
 *
 * <p>All failures raise {@link IllegalArgumentException} naming the offending path so the CLI can report
 * them as argument errors.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures a path names an existing, readable regular file.
   *
   * @param name parameter name for diagnostics
   * @param path candidate file
   * @return absolute, normalized path
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " does not exist or is not a file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Ensures a path names an existing, readable directory.
   *
   * @param name parameter name for diagnostics
   * @param path candidate directory
   * @return absolute, normalized path
   */
  public static Path requireReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " does not exist or is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Ensures an output file can be created: the parent directory must exist and be writable, and the path
   * must not be a directory.
   *
   * @param name parameter name for diagnostics
   * @param path candidate output file
   * @return absolute, normalized path
   */
  public static Path requireWritableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
