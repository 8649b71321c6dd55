package ca.gc.cra.diagloc.api;

import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import ca.gc.cra.diagloc.config.DefinitionsLoader;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.domain.diag.MessageCatalog;
import ca.gc.cra.diagloc.domain.diag.UnknownIdentifierRecord;
import ca.gc.cra.diagloc.infrastructure.persistence.strings.MalformedStringsException;
import ca.gc.cra.diagloc.infrastructure.persistence.strings.StringsFileParser;
import ca.gc.cra.diagloc.infrastructure.persistence.table.SerializedTableWriter;
import ca.gc.cra.diagloc.infrastructure.persistence.yaml.LocalizationFormatException;
import ca.gc.cra.diagloc.infrastructure.persistence.yaml.YamlLocalizationParser;
import ca.gc.cra.diagloc.logging.LoggingConfigurator;
import ca.gc.cra.diagloc.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@code .yaml} or {@code .strings} catalog into the binary {@code .db} table.
 *
 * @since 0.1.0
 */
public final class SerializeCli {
  private static final Logger log = LoggerFactory.getLogger(SerializeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: serialize in=FILE.yaml|FILE.strings out=FILE.db [defs=./diagnostics.yaml] [config=FILE]";
  private static final String HELP_TEXT = """
      DIAGLOC serialize

      Usage:
        serialize in=./localization/fr.yaml out=./localization/fr.db [options]

      Required:
        in=PATH          Source catalog; format chosen from the .yaml or .strings extension
        out=PATH         Destination table (replaced when it exists)

      Optional:
        defs=PATH        Diagnostic definitions (default ./diagnostics.yaml)
        config=PATH      YAML config with common/serialize sections
        --verbose        Enable DEBUG logging
        --help           Show this message

      Notes:
        Records whose id is not defined are reported and left out of the table.
      """;

  private SerializeCli() {}

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
   * Runs the serializer and returns its exit code.
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
      log.debug("Verbose logging enabled for serialize CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliUtils.EffectiveConfig config =
        ConfigCliUtils.effectiveConfig("serialize", kv, log, SUMMARY_USAGE);
    if (config.failed()) {
      return config.status();
    }
    Map<String, String> effective = config.values();

    Path in;
    Path out;
    LocalizationFormat format;
    try {
      in = Paths.requireReadableFile("in", Path.of(require(effective, "in")));
      Optional<LocalizationFormat> detected = LocalizationFormat.fromPath(in);
      if (detected.isEmpty() || detected.get() == LocalizationFormat.SERIALIZED) {
        throw new IllegalArgumentException("in must end with .yaml or .strings: " + in);
      }
      format = detected.get();
      out = Paths.prepareOutputFile("out", Path.of(require(effective, "out")), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serialize arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path defs = Path.of(effective.get("defs"));
    try {
      DiagnosticIdentifierSpace identifiers = DefinitionsLoader.load(defs);
      MessageCatalog catalog = read(format, in, identifiers);

      SerializedTableWriter writer = new SerializedTableWriter();
      catalog.forEachAvailable(writer::insert);
      if (!writer.emit(out)) {
        return ExitCode.IO_ERROR;
      }
      log.info("Serialized {} of {} diagnostics from {} to {}", writer.size(), identifiers.size(), in, out);
      return ExitCode.SUCCESS;
    } catch (LocalizationFormatException | MalformedStringsException ex) {
      log.error("Malformed catalog {}: {}", in, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid diagnostic definitions {}: {}", defs, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Serialize I/O failure while reading {}", in, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in serialize", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static MessageCatalog read(
      LocalizationFormat format, Path in, DiagnosticIdentifierSpace identifiers) throws IOException {
    if (format == LocalizationFormat.STRINGS) {
      return new StringsFileParser(identifiers).parse(in);
    }
    YamlLocalizationParser.Result result = new YamlLocalizationParser(identifiers).parse(in);
    for (UnknownIdentifierRecord unknown : result.unknownIdentifiers()) {
      log.warn("Unknown diagnostic in {}: {}", in, unknown.rawId());
    }
    return result.catalog();
  }

  private static String require(Map<String, String> effective, String key) {
    String value = effective.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("missing required argument " + key + "=PATH");
    }
    return value.trim();
  }
}
