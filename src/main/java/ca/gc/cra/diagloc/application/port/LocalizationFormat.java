package ca.gc.cra.diagloc.application.port;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * On-disk catalog formats, listed in resolution priority order.
 *
 * @since 0.1.0
 */
public enum LocalizationFormat {
  /** Binary hash table, fastest to open and query. */
  SERIALIZED(".db"),
  /** Sequence of {@code id}/{@code msg} mappings. */
  YAML(".yaml"),
  /** Flat {@code "id" = "msg";} records. */
  STRINGS(".strings");

  private final String extension;

  LocalizationFormat(String extension) {
    this.extension = extension;
  }

  /** @return file extension including the leading dot */
  public String extension() {
    return extension;
  }

  /**
   * Returns the catalog file for {@code locale} inside {@code directory}.
   *
   * @param directory catalog directory
   * @param locale locale tag such as {@code fr} or {@code pt-BR}
   * @return {@code directory/locale + extension}
   */
  public Path fileFor(Path directory, String locale) {
    return directory.resolve(locale + extension);
  }

  /**
   * Infers the format from a file name extension (case-insensitive).
   *
   * @param path catalog file
   * @return matching format, or empty when the extension is not recognized
   */
  public static Optional<LocalizationFormat> fromPath(Path path) {
    if (path == null || path.getFileName() == null) {
      return Optional.empty();
    }
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    for (LocalizationFormat format : values()) {
      if (name.endsWith(format.extension)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /**
   * Parses a format name such as {@code yaml} or {@code strings}.
   *
   * @param value format name, case-insensitive; a leading dot is tolerated
   * @return parsed format
   * @throws IllegalArgumentException if {@code value} does not name a format
   */
  public static LocalizationFormat parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("format must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    return switch (normalized) {
      case "db", "serialized" -> SERIALIZED;
      case "yaml", "yml" -> YAML;
      case "strings" -> STRINGS;
      default -> throw new IllegalArgumentException("Unsupported format: " + value);
    };
  }
}
