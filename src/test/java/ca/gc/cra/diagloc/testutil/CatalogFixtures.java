package ca.gc.cra.diagloc.testutil;

import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Small identifier space and matching definition file shared by catalog tests. */
public final class CatalogFixtures {
  public static final String UNKNOWN_TYPE = "error_unknown_type";
  public static final String UNUSED_VALUE = "warning_unused_value";
  public static final String DECLARED_HERE = "note_declared_here";

  private static final String DEFINITIONS_YAML = """
      - id: error_unknown_type
        text: "cannot find type %0 in scope"
      - id: warning_unused_value
        text: "value %0 was never used"
      - id: note_declared_here
        text: "declared here"
      """;

  private CatalogFixtures() {}

  /** Three-entry space: 0 = error_unknown_type, 1 = warning_unused_value, 2 = note_declared_here. */
  public static DiagnosticIdentifierSpace identifiers() {
    return DiagnosticIdentifierSpace.ofPairs(
        UNKNOWN_TYPE, "cannot find type %0 in scope",
        UNUSED_VALUE, "value %0 was never used",
        DECLARED_HERE, "declared here");
  }

  /** Writes the definitions matching {@link #identifiers()} to {@code dir/diagnostics.yaml}. */
  public static Path writeDefinitions(Path dir) throws IOException {
    Path defs = dir.resolve("diagnostics.yaml");
    Files.writeString(defs, DEFINITIONS_YAML, StandardCharsets.UTF_8);
    return defs;
  }
}
