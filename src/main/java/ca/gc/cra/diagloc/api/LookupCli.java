package ca.gc.cra.diagloc.api;

import ca.gc.cra.diagloc.application.localization.MessageStore;
import ca.gc.cra.diagloc.config.DefinitionsLoader;
import ca.gc.cra.diagloc.config.LocalizationConfig;
import ca.gc.cra.diagloc.config.MessageStoreResolver;
import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.infrastructure.persistence.strings.MalformedStringsException;
import ca.gc.cra.diagloc.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the localized text of one diagnostic, or its default text when the locale has none.
 *
 * @since 0.1.0
 */
public final class LookupCli {
  private static final Logger log = LoggerFactory.getLogger(LookupCli.class);
  private static final String SUMMARY_USAGE =
      "usage: lookup id=NAME [dir=./localization locale=en defs=./diagnostics.yaml] [--debug-names] [config=FILE]";
  private static final String HELP_TEXT = """
      DIAGLOC lookup

      Usage:
        lookup id=error_unknown_type locale=fr [options]

      Required:
        id=NAME          Diagnostic name as declared in the definitions

      Optional:
        dir=PATH         Catalog directory (default ./localization)
        locale=TAG       Locale tag naming <dir>/<locale>.db|.yaml|.strings (default en)
        defs=PATH        Diagnostic definitions (default ./diagnostics.yaml)
        --debug-names    Suffix localized text with " [NAME]"
        config=PATH      YAML config with common/lookup sections
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private LookupCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the lookup and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for lookup CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag(CliInput.DEBUG_NAMES)) {
      kv.put("debugNames", "true");
    }

    ConfigCliUtils.EffectiveConfig effective =
        ConfigCliUtils.effectiveConfig("lookup", kv, log, SUMMARY_USAGE);
    if (effective.failed()) {
      return effective.status();
    }

    String name = effective.values().get("id");
    LocalizationConfig config;
    try {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("missing required argument id=NAME");
      }
      config = LocalizationConfig.fromMap(effective.values());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid lookup arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      DiagnosticIdentifierSpace identifiers = DefinitionsLoader.load(config.definitions());
      OptionalInt index = identifiers.indexOf(name.trim());
      if (index.isEmpty()) {
        log.error("Unknown diagnostic: {}", name);
        return ExitCode.NOT_FOUND;
      }
      DiagnosticId id = DiagnosticId.of(index.getAsInt());

      Optional<MessageStore> store = MessageStoreResolver.resolve(
          config.locale(), config.directory(), identifiers, config.printDiagnosticNames());
      if (store.isEmpty()) {
        log.info("No catalog for locale {} in {}; using default text", config.locale(), config.directory());
        CliPrinter.println(identifiers.defaultText(id));
      } else {
        CliPrinter.println(store.get().message(id));
      }
      return ExitCode.SUCCESS;
    } catch (MalformedStringsException ex) {
      log.error("Malformed catalog for locale {}: {}", config.locale(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid diagnostic definitions {}: {}", config.definitions(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read diagnostic definitions {}", config.definitions(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in lookup", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
