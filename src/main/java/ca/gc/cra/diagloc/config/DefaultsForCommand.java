package ca.gc.cra.diagloc.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each DIAGLOC tool command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForCommand {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "defs", "./diagnostics.yaml",
      "verbose", "false");

  private DefaultsForCommand() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command target command (serialize, convert, lookup, dump)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "serialize", "convert" -> Map.of();
      case "lookup", "dump" -> Map.of(
          "dir", LocalizationConfig.DEFAULT_DIRECTORY.toString(),
          "locale", LocalizationConfig.DEFAULT_LOCALE,
          "debugNames", "false");
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }
}
