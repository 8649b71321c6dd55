package ca.gc.cra.diagloc.config;

import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final List<String> BOOLEAN_KEYS = List.of("debugNames", "allowOverwrite", "verbose");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param command active tool command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(command, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    String format = trim(effective.get("format"));
    if ("convert".equalsIgnoreCase(command) && !format.isEmpty()) {
      if (LocalizationFormat.parse(format) == LocalizationFormat.SERIALIZED) {
        throw new IllegalArgumentException("convert format must be yaml or strings");
      }
    }
    for (String key : BOOLEAN_KEYS) {
      String value = trim(effective.get(key));
      if (!value.isEmpty() && !value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
        throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
