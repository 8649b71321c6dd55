package ca.gc.cra.diagloc.config;

import ca.gc.cra.diagloc.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for resolving and querying one locale's message store.
 * <p><strong>Why:</strong> Centralizes parsing of {@code dir}, {@code locale}, {@code defs} and
 * {@code debugNames} so the lookup and dump commands validate identically.</p>
 * <p><strong>Thread-safety:</strong> Record instances are immutable.</p>
 *
 * @param directory directory holding {@code <locale>.db|.yaml|.strings} catalogs
 * @param locale locale tag naming the catalog file
 * @param definitions YAML file listing the master diagnostic catalog
 * @param printDiagnosticNames whether returned text is suffixed with {@code " [<name>]"}
 * @since 0.1.0
 */
public record LocalizationConfig(
    Path directory,
    String locale,
    Path definitions,
    boolean printDiagnosticNames) {

  /** Default catalog directory. */
  public static final Path DEFAULT_DIRECTORY = Path.of("./localization");
  /** Default locale tag. */
  public static final String DEFAULT_LOCALE = "en";

  /**
   * Validates components.
   *
   * @throws IllegalArgumentException if the locale is blank or names a path
   */
  public LocalizationConfig {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(definitions, "definitions");
    locale = requireLocaleTag(locale);
  }

  /**
   * Builds a config from a flat, already merged key/value map.
   *
   * @param values effective configuration
   * @return validated configuration
   * @throws IllegalArgumentException when required keys are missing or invalid
   */
  public static LocalizationConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    String dir = values.getOrDefault("dir", DEFAULT_DIRECTORY.toString());
    String locale = values.getOrDefault("locale", DEFAULT_LOCALE);
    String defs = values.get("defs");
    if (defs == null || defs.isBlank()) {
      throw new IllegalArgumentException("defs is required");
    }
    boolean debugNames = Boolean.parseBoolean(values.getOrDefault("debugNames", "false").trim());
    return new LocalizationConfig(
        Path.of(Strings.requireNonBlank("dir", dir)),
        locale,
        Path.of(Strings.requireNonBlank("defs", defs)),
        debugNames);
  }

  /**
   * Validates a locale tag used as a catalog file stem.
   *
   * @param locale candidate tag
   * @return trimmed tag
   * @throws IllegalArgumentException if blank, containing control characters, or containing path separators
   */
  public static String requireLocaleTag(String locale) {
    String tag = Strings.requireNonBlank("locale", locale);
    if (tag.indexOf('/') >= 0 || tag.indexOf('\\') >= 0 || tag.equals(".") || tag.equals("..")) {
      throw new IllegalArgumentException("locale must not contain path separators: " + tag);
    }
    return tag;
  }
}
