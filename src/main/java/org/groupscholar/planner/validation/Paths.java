package org.groupscholar.planner.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Filesystem checks run before adapters open input or output files.
 *
 * <p>Failures raise {@link IllegalArgumentException} with the offending path so the CLI can report them as
 * invalid arguments instead of I/O errors.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user-supplied path.
   *
   * @param name option name for diagnostics
   * @param raw raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException when the text is blank, contains control characters or is not a path
   */
  public static Path parse(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(sanitized).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + sanitized, ex);
    }
  }

  /**
   * Ensures {@code path} names an existing readable regular file.
   *
   * @param name option name for diagnostics
   * @param path candidate file
   * @return the same path
   * @throws IllegalArgumentException when the file is missing, a directory, or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(name + " does not exist: " + path);
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return path;
  }

  /**
   * Ensures a file can be created or replaced at {@code path}: it must not be a directory and its nearest
   * existing ancestor must be a writable directory.
   *
   * @param name option name for diagnostics
   * @param path candidate output file
   * @return the same path
   * @throws IllegalArgumentException when the target cannot be written
   */
  public static Path validateWritableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (Files.isDirectory(path)) {
      throw new IllegalArgumentException(name + " must be a file, not a directory: " + path);
    }
    if (Files.exists(path) && !Files.isWritable(path)) {
      throw new IllegalArgumentException(name + " is not writable: " + path);
    }
    Path ancestor = path.toAbsolutePath().getParent();
    while (ancestor != null && !Files.exists(ancestor)) {
      ancestor = ancestor.getParent();
    }
    if (ancestor == null || !Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + path);
    }
    return path;
  }
}
