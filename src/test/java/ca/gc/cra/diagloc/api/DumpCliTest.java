package ca.gc.cra.diagloc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.infrastructure.persistence.table.SerializedTableWriter;
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

class DumpCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;
  private Path defs;
  private Path dir;

  @BeforeEach
  void setUp() throws IOException {
    logger = (Logger) LoggerFactory.getLogger(DumpCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    defs = CatalogFixtures.writeDefinitions(tempDir);
    dir = Files.createDirectory(tempDir.resolve("l10n"));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    CliPrinter.clearTestWriter();
  }

  @Test
  void binaryCatalogIsPrintedInIdentifierOrder() {
    SerializedTableWriter writer = new SerializedTableWriter();
    writer.insert(DiagnosticId.of(2), "déclaré ici");
    writer.insert(DiagnosticId.of(0), "type %0 introuvable");
    assertTrue(writer.emit(dir.resolve("fr.db")));

    ExitCode code = DumpCli.run(new String[] {"dir=" + dir, "defs=" + defs, "locale=fr"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(
        List.of("error_unknown_type\ttype %0 introuvable", "note_declared_here\tdéclaré ici"),
        buffer.toString().lines().toList());
  }

  @Test
  void unknownYamlRecordsAreReported() throws IOException {
    Files.writeString(dir.resolve("fr.yaml"), """
        - id: warning_unused_value
          msg: "valeur inutilisée"
        - id: dropped_note
          msg: "abandonné"
        """);

    ExitCode code = DumpCli.run(new String[] {"dir=" + dir, "defs=" + defs, "locale=fr"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("warning_unused_value\tvaleur inutilisée"), buffer.toString().lines().toList());
    boolean warned = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().endsWith(": dropped_note"));
    assertTrue(warned);
  }

  @Test
  void missingCatalogReturnsNotFound() {
    assertEquals(ExitCode.NOT_FOUND,
        DumpCli.run(new String[] {"dir=" + dir, "defs=" + defs, "locale=ja"}));
  }

  @Test
  void unloadableCatalogReturnsConfigError() throws IOException {
    Files.writeString(dir.resolve("fr.yaml"), "just: a map\n");

    assertEquals(ExitCode.CONFIG_ERROR,
        DumpCli.run(new String[] {"dir=" + dir, "defs=" + defs, "locale=fr"}));
    assertTrue(buffer.toString().isEmpty());
  }
}
