package ca.gc.cra.diagloc.api;

import ca.gc.cra.diagloc.application.localization.MessageStore;
import ca.gc.cra.diagloc.application.localization.ProducerState;
import ca.gc.cra.diagloc.config.DefinitionsLoader;
import ca.gc.cra.diagloc.config.LocalizationConfig;
import ca.gc.cra.diagloc.config.MessageStoreResolver;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.domain.diag.UnknownIdentifierRecord;
import ca.gc.cra.diagloc.infrastructure.persistence.strings.MalformedStringsException;
import ca.gc.cra.diagloc.infrastructure.persistence.yaml.YamlLocalizationBackend;
import ca.gc.cra.diagloc.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints every translated message of a locale as {@code NAME<TAB>text}, in identifier order.
 *
 * @since 0.1.0
 */
public final class DumpCli {
  private static final Logger log = LoggerFactory.getLogger(DumpCli.class);
  private static final String SUMMARY_USAGE =
      "usage: dump [dir=./localization locale=en defs=./diagnostics.yaml] [config=FILE]";
  private static final String HELP_TEXT = """
      DIAGLOC dump

      Usage:
        dump locale=fr [options]

      Optional:
        dir=PATH         Catalog directory (default ./localization)
        locale=TAG       Locale tag naming <dir>/<locale>.db|.yaml|.strings (default en)
        defs=PATH        Diagnostic definitions (default ./diagnostics.yaml)
        config=PATH      YAML config with common/dump sections
        --verbose        Enable DEBUG logging
        --help           Show this message

      Notes:
        Diagnostics without a translation are not printed.
      """;

  private DumpCli() {}

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
   * Runs the dump and returns its exit code.
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
      log.debug("Verbose logging enabled for dump CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.EffectiveConfig effective =
        ConfigCliUtils.effectiveConfig("dump", kv, log, SUMMARY_USAGE);
    if (effective.failed()) {
      return effective.status();
    }

    LocalizationConfig config;
    try {
      config = LocalizationConfig.fromMap(effective.values());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid dump arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      DiagnosticIdentifierSpace identifiers = DefinitionsLoader.load(config.definitions());
      Optional<MessageStore> resolved =
          MessageStoreResolver.resolve(config.locale(), config.directory(), identifiers);
      if (resolved.isEmpty()) {
        log.error("No catalog for locale {} in {}", config.locale(), config.directory());
        return ExitCode.NOT_FOUND;
      }
      MessageStore store = resolved.get();
      if (store.initializeIfNeeded() == ProducerState.FAILED_INITIALIZATION) {
        log.error("Catalog for locale {} could not be loaded", config.locale());
        return ExitCode.CONFIG_ERROR;
      }
      if (store.backend() instanceof YamlLocalizationBackend yaml) {
        for (UnknownIdentifierRecord unknown : yaml.unknownIdentifiers()) {
          log.warn("Unknown diagnostic in {}: {}", yaml.path(), unknown.rawId());
        }
      }

      int[] printed = {0};
      store.forEachAvailable((id, text) -> {
        CliPrinter.println(identifiers.nameOf(id) + "\t" + text);
        printed[0]++;
      });
      log.info("Printed {} of {} diagnostics for locale {}", printed[0], identifiers.size(), config.locale());
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
      log.error("Unexpected runtime failure in dump", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
