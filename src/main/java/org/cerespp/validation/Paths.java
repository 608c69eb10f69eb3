package org.cerespp.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation helpers for input spectra and output directories.
 * <p><strong>Why:</strong> Rejects unreadable inputs and unwritable outputs before any spectrum is processed.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} is a readable regular file.
   *
   * @param name configuration key used in error messages
   * @param path candidate file
   * @return normalized absolute path
   * @throws IllegalArgumentException if the path is missing, not a regular file or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    requireClean(path);
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output directory, optionally creating it.
   *
   * @param path candidate directory
   * @param createIfMissing create the directory (and parents) when absent
   * @return real path of the directory, or the normalized path when it does not exist and is not created
   * @throws IllegalArgumentException if the path is not a writable directory or cannot be created
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    requireClean(path);
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath();
        ensureWritableDirectory(real);
        return real;
      }
      if (!createIfMissing) {
        return normalized;
      }
      Files.createDirectories(normalized);
      Path real = normalized.toRealPath();
      ensureWritableDirectory(real);
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void ensureWritableDirectory(Path dir) {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
  }

  private static void requireClean(Path path) {
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
  }
}
