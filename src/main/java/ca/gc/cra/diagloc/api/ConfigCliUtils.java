package ca.gc.cra.diagloc.api;

import ca.gc.cra.diagloc.config.ConfigMerger;
import ca.gc.cra.diagloc.config.DefaultsForCommand;
import ca.gc.cra.diagloc.config.YamlConfigLoader;
import ca.gc.cra.diagloc.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }

  /**
   * Applies {@code config=FILE} (if any), embedded defaults, and CLI overrides for {@code command}.
   * A {@code verbose: true} setting switches logging to DEBUG like {@code --verbose}.
   *
   * @param command tool command name
   * @param kv mutable CLI map; the {@code config} key is consumed
   * @param log caller logger used for errors and override warnings
   * @param usage summary usage printed on argument errors
   * @return merged settings, or the exit code to return when merging failed
   */
  static EffectiveConfig effectiveConfig(
      String command, Map<String, String> kv, Logger log, String usage) {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return EffectiveConfig.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, command);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return EffectiveConfig.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return EffectiveConfig.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          command, yamlConfig, kv, DefaultsForCommand.asFlatMap(command), log::warn);
      if (parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      return new EffectiveConfig(effective, ExitCode.SUCCESS);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      return EffectiveConfig.failed(ExitCode.INVALID_ARGS);
    }
  }

  record EffectiveConfig(Map<String, String> values, ExitCode status) {
    static EffectiveConfig failed(ExitCode status) {
      return new EffectiveConfig(Map.of(), status);
    }

    boolean failed() {
      return status != ExitCode.SUCCESS;
    }
  }
}
