package ca.gc.cra.diagloc.config;

import ca.gc.cra.diagloc.infrastructure.persistence.yaml.PlainScalarYaml;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the DIAGLOC tool configuration file.
 *
 * <pre>
 * common:
 *   defs: ./diagnostics.yaml
 * lookup:
 *   dir: ./localization
 *   locale: fr
 * </pre>
 *
 * <p>The document holds at most one {@code common} section and one section per command. Each section is a
 * flat mapping of scalar settings; every key must be one the section accepts, so a misspelt {@code locle}
 * fails the load instead of silently falling back to a default. All sections are checked, not only the one
 * for the running command. Values are taken as written ({@code locale: no} stays {@code "no"}).</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";

  private static final Set<String> COMMON_KEYS = Set.of("defs", "verbose", "dir", "locale", "debugNames");

  private static final Map<String, Set<String>> COMMAND_KEYS = Map.of(
      "serialize", Set.of("defs", "verbose", "in", "out"),
      "convert", Set.of("defs", "verbose", "out", "format", "allowOverwrite"),
      "lookup", Set.of("defs", "verbose", "dir", "locale", "debugNames", "id"),
      "dump", Set.of("defs", "verbose", "dir", "locale", "debugNames"));

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and returns the {@code common} settings overlaid with the {@code command} section.
   *
   * @param path location of the YAML configuration
   * @param command tool command (serialize, convert, lookup, dump)
   * @return settings for {@code command}; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the command is unknown, the YAML is malformed, or a section holds
   *     a key it does not accept
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String active = sectionName(Objects.requireNonNull(command, "command"));
    if (!COMMAND_KEYS.containsKey(active)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = PlainScalarYaml.newLoader().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + ": configuration root must be a mapping of sections");
    }

    Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = sectionName(String.valueOf(entry.getKey()));
      Set<String> allowed = COMMON.equals(name) ? COMMON_KEYS : COMMAND_KEYS.get(name);
      if (allowed == null) {
        throw new IllegalArgumentException(
            "Unknown configuration section '" + entry.getKey() + "' (expected one of "
                + sectionNames() + ")");
      }
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("Configuration section '" + name + "' appears more than once");
      }
      sections.put(name, readSection(name, entry.getValue(), allowed));
    }

    Map<String, String> settings = new LinkedHashMap<>(sections.getOrDefault(COMMON, Map.of()));
    settings.putAll(sections.getOrDefault(active, Map.of()));
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, String> readSection(String name, Object node, Set<String> allowed) {
    if (node == null || "".equals(node)) {
      return Map.of();
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("Configuration section '" + name + "' must be a mapping");
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      String key = String.valueOf(entry.getKey()).trim();
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException(
            "Key '" + key + "' is not accepted in section '" + name + "' (expected one of "
                + new TreeSet<>(allowed) + ")");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Key '" + name + "." + key + "' must be a single value");
      }
      values.put(key, value == null ? "" : value.toString());
    }
    return values;
  }

  private static Set<String> sectionNames() {
    Set<String> names = new TreeSet<>(COMMAND_KEYS.keySet());
    names.add(COMMON);
    return names;
  }

  private static String sectionName(String raw) {
    return raw.trim().toLowerCase(Locale.ROOT);
  }
}
