package ca.gc.cra.diagloc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagloc.testutil.CatalogFixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String text = buffer.toString();
    assertTrue(text.contains("serialize"));
    assertTrue(text.contains("dump"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: diagloc"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"translate"}));
    assertTrue(buffer.toString().contains("usage: diagloc"));
  }

  @Test
  void subcommandHelpIsForwarded() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"lookup", "--help"}));
    assertTrue(buffer.toString().contains("DIAGLOC lookup"));
  }

  @Test
  void dispatchesToLookupWithFlags() throws IOException {
    Path defs = CatalogFixtures.writeDefinitions(tempDir);

    ExitCode code = Main.run(new String[] {
        "LOOKUP", "dir=" + tempDir, "defs=" + defs, "id=note_declared_here", "--debug-names"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("declared here"), buffer.toString().lines().toList());
  }
}
