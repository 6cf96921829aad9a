package io.qzss.dcragent.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Filesystem checks for the report file and cache dump locations.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code file} can be created or appended to.
   *
   * @param name option name used in error messages
   * @param file target file
   * @param createParents create a missing parent directory instead of failing
   * @return normalized absolute path
   * @throws IllegalArgumentException if the file is a directory, or its parent is missing or not writable
   */
  public static Path validateWritableFile(String name, Path file, boolean createParents) {
    if (file == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (Strings.containsControl(file.toString())) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    Path normalized = file.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " is not writable: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    if (!Files.exists(parent)) {
      if (!createParents) {
        throw new IllegalArgumentException(name + " directory does not exist: " + parent);
      }
      try {
        Files.createDirectories(parent);
      } catch (IOException ex) {
        throw new IllegalArgumentException("unable to create " + parent + " for " + name + ": " + ex.getMessage(),
            ex);
      }
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " directory is not writable: " + parent);
    }
    return normalized;
  }
}
