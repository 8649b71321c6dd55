package ca.gc.cra.diagloc.api;

import ca.gc.cra.diagloc.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DIAGLOC CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: diagloc <serialize|convert|lookup|dump> [options]";
  private static final String HELP_TEXT = """
      DIAGLOC command dispatcher

      Usage:
        diagloc <command> [options]

      Commands:
        serialize   Compile a .yaml or .strings catalog into a binary .db table
        convert     Write a translator template from the diagnostic definitions
        lookup      Print the localized message for one diagnostic
        dump        Print every translated message of a locale

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, indexOfCommand(args, remainder[0]) + 1, args.length);

    return switch (command) {
      case "serialize" -> SerializeCli.run(delegateArgs);
      case "convert" -> ConvertCli.run(delegateArgs);
      case "lookup" -> LookupCli.run(delegateArgs);
      case "dump" -> DumpCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int indexOfCommand(String[] args, String command) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(command)) {
        return i;
      }
    }
    return args.length - 1;
  }
}
