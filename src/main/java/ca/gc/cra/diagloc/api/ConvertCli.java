package ca.gc.cra.diagloc.api;

import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import ca.gc.cra.diagloc.config.DefinitionsLoader;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.infrastructure.persistence.strings.DefToStringsConverter;
import ca.gc.cra.diagloc.infrastructure.persistence.yaml.DefToYamlConverter;
import ca.gc.cra.diagloc.logging.LoggingConfigurator;
import ca.gc.cra.diagloc.validation.Paths;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a translator template (YAML or {@code .strings}) holding every diagnostic's default text.
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final String SUMMARY_USAGE =
      "usage: convert out=FILE [format=yaml|strings] [defs=./diagnostics.yaml] [--allow-overwrite] [config=FILE]";
  private static final String HELP_TEXT = """
      DIAGLOC convert

      Usage:
        convert out=./localization/en.yaml [options]

      Required:
        out=PATH             Template to write

      Optional:
        format=yaml|strings  Template format (default: taken from the out extension)
        defs=PATH            Diagnostic definitions (default ./diagnostics.yaml)
        --allow-overwrite    Replace an existing template
        config=PATH          YAML config with common/convert sections
        --verbose            Enable DEBUG logging
        --help               Show this message
      """;

  private ConvertCli() {}

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
   * Runs the template converter and returns its exit code.
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
      log.debug("Verbose logging enabled for convert CLI");
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
        ConfigCliUtils.effectiveConfig("convert", kv, log, SUMMARY_USAGE);
    if (config.failed()) {
      return config.status();
    }
    Map<String, String> effective = config.values();
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Path out;
    LocalizationFormat format;
    try {
      String outRaw = effective.get("out");
      if (outRaw == null || outRaw.isBlank()) {
        throw new IllegalArgumentException("missing required argument out=PATH");
      }
      out = Path.of(outRaw.trim());
      format = resolveFormat(effective.get("format"), out);
      out = Paths.prepareOutputFile("out", out, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path defs = Path.of(effective.get("defs"));
    try {
      DiagnosticIdentifierSpace identifiers = DefinitionsLoader.load(defs);
      try (Writer writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
        if (format == LocalizationFormat.YAML) {
          new DefToYamlConverter(identifiers.definitions()).convert(writer);
        } else {
          new DefToStringsConverter(identifiers.definitions()).convert(writer);
        }
      }
      log.info("Wrote {} template with {} diagnostics to {}", format, identifiers.size(), out);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid diagnostic definitions {}: {}", defs, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Convert I/O failure writing {}", out, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in convert", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static LocalizationFormat resolveFormat(String requested, Path out) {
    LocalizationFormat format;
    if (requested != null && !requested.isBlank()) {
      format = LocalizationFormat.parse(requested);
    } else {
      format = LocalizationFormat.fromPath(out)
          .orElseThrow(() -> new IllegalArgumentException(
              "format=yaml|strings is required when out has no .yaml or .strings extension"));
    }
    if (format == LocalizationFormat.SERIALIZED) {
      throw new IllegalArgumentException("convert format must be yaml or strings");
    }
    return format;
  }
}
