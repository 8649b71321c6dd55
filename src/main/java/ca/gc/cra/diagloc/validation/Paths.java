package ca.gc.cra.diagloc.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for DIAGLOC CLI flows.
 * <p><strong>Why:</strong> Converters read catalogs and write templates or tables; checking inputs and
 * destinations before any work starts turns filesystem surprises into usage errors.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} is an existing, readable regular file.
   *
   * @param name logical parameter name used in messages
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output file destination, creating missing parent directories.
   *
   * @param name logical parameter name used in messages
   * @param path destination file
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the destination exists without approval, is a directory, or its
   *     parent cannot be prepared
   */
  public static Path prepareOutputFile(String name, Path path, boolean allowOverwrite) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to create parent directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || Strings.containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
