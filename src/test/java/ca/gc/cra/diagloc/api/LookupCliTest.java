package ca.gc.cra.diagloc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagloc.testutil.CatalogFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LookupCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;
  private Path defs;
  private Path dir;

  @BeforeEach
  void setUp() throws IOException {
    logger = (Logger) LoggerFactory.getLogger(LookupCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    defs = CatalogFixtures.writeDefinitions(tempDir);
    dir = Files.createDirectory(tempDir.resolve("l10n"));
    Files.writeString(dir.resolve("fr.yaml"), """
        - id: error_unknown_type
          msg: "type %0 introuvable"
        """);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsLocalizedMessage() {
    ExitCode code = LookupCli.run(args("fr", "error_unknown_type"));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("type %0 introuvable"), buffer.toString().lines().toList());
  }

  @Test
  void debugNamesFlagAppendsDiagnosticName() {
    ExitCode code = LookupCli.run(append(args("fr", "error_unknown_type"), "--debug-names"));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("type %0 introuvable [error_unknown_type]"), buffer.toString().lines().toList());
  }

  @Test
  void untranslatedDiagnosticPrintsDefaultText() {
    LookupCli.run(args("fr", "note_declared_here"));

    assertEquals(List.of("declared here"), buffer.toString().lines().toList());
  }

  @Test
  void missingLocalePrintsDefaultText() {
    ExitCode code = LookupCli.run(args("ja", "warning_unused_value"));

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("value %0 was never used"), buffer.toString().lines().toList());
  }

  @Test
  void localeCanComeFromConfigFile() throws IOException {
    Path config = Files.writeString(tempDir.resolve("diagloc.yaml"), """
        lookup:
          locale: fr
          debugNames: true
        """);

    ExitCode code = LookupCli.run(new String[] {
        "dir=" + dir, "defs=" + defs, "id=error_unknown_type", "config=" + config});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("type %0 introuvable [error_unknown_type]"), buffer.toString().lines().toList());
  }

  @Test
  void unknownDiagnosticReturnsNotFound() {
    ExitCode code = LookupCli.run(args("fr", "no_such_diagnostic"));

    assertEquals(ExitCode.NOT_FOUND, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("no_such_diagnostic"));
    assertTrue(logged);
  }

  @Test
  void missingIdReturnsUsage() {
    ExitCode code = LookupCli.run(new String[] {"dir=" + dir, "defs=" + defs, "locale=fr"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: lookup"));
  }

  @Test
  void malformedStringsCatalogReturnsConfigError() throws IOException {
    Files.writeString(dir.resolve("de.strings"), "\"error_unknown_type\" = \"kaputt\n");

    assertEquals(ExitCode.CONFIG_ERROR, LookupCli.run(args("de", "error_unknown_type")));
  }

  @Test
  void localeWithPathSeparatorIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, LookupCli.run(args("../fr", "error_unknown_type")));
  }

  private String[] args(String locale, String id) {
    return new String[] {"dir=" + dir, "defs=" + defs, "locale=" + locale, "id=" + id};
  }

  private static String[] append(String[] args, String extra) {
    String[] result = java.util.Arrays.copyOf(args, args.length + 1);
    result[args.length] = extra;
    return result;
  }
}
