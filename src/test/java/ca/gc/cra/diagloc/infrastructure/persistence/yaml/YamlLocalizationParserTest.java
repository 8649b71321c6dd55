package ca.gc.cra.diagloc.infrastructure.persistence.yaml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagloc.domain.diag.DiagnosticDefinition;
import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.domain.diag.UnknownIdentifierRecord;
import ca.gc.cra.diagloc.testutil.CatalogFixtures;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlLocalizationParserTest {
  @TempDir Path tempDir;

  private final DiagnosticIdentifierSpace identifiers = CatalogFixtures.identifiers();
  private final YamlLocalizationParser parser = new YamlLocalizationParser(identifiers);

  @Test
  void recordsFillSlotsByIdentifierRegardlessOfOrder() throws Exception {
    YamlLocalizationParser.Result result = parser.parse("""
        - id: note_declared_here
          msg: "déclaré ici"
        - id: error_unknown_type
          msg: "type %0 introuvable"
        """);

    assertEquals(Optional.of("type %0 introuvable"), result.catalog().message(DiagnosticId.of(0)));
    assertTrue(result.catalog().message(DiagnosticId.of(1)).isEmpty());
    assertEquals(Optional.of("déclaré ici"), result.catalog().message(DiagnosticId.of(2)));
    assertTrue(result.unknownIdentifiers().isEmpty());
  }

  @Test
  void unknownIdentifiersAreIsolatedInInputOrder() throws Exception {
    YamlLocalizationParser.Result result = parser.parse("""
        - id: removed_diagnostic
          msg: "obsolète"
        - id: warning_unused_value
          msg: "valeur %0 inutilisée"
        - id: renamed_diagnostic
          msg: "renommé"
        """);

    assertEquals(1, result.catalog().availableCount());
    assertEquals(
        List.of(
            new UnknownIdentifierRecord("removed_diagnostic", "obsolète"),
            new UnknownIdentifierRecord("renamed_diagnostic", "renommé")),
        result.unknownIdentifiers());
  }

  @Test
  void emptyDocumentYieldsEmptyCatalog() throws Exception {
    YamlLocalizationParser.Result result = parser.parse("");

    assertEquals(0, result.catalog().availableCount());
    assertEquals(3, result.catalog().size());
  }

  @Test
  void emptyMessageIsTreatedAsMissing() throws Exception {
    YamlLocalizationParser.Result result = parser.parse("""
        - id: error_unknown_type
          msg:
        """);

    assertTrue(result.catalog().message(DiagnosticId.of(0)).isEmpty());
  }

  @Test
  void plainScalarsKeepTheirWrittenText() throws Exception {
    YamlLocalizationParser.Result result = parser.parse("""
        - id: error_unknown_type
          msg: Yes
        - id: warning_unused_value
          msg: 0x10
        - id: note_declared_here
          msg: 2024-01-01
        - id: off
          msg: 1_000
        """);

    assertEquals(Optional.of("Yes"), result.catalog().message(DiagnosticId.of(0)));
    assertEquals(Optional.of("0x10"), result.catalog().message(DiagnosticId.of(1)));
    assertEquals(Optional.of("2024-01-01"), result.catalog().message(DiagnosticId.of(2)));
    assertEquals(List.of(new UnknownIdentifierRecord("off", "1_000")), result.unknownIdentifiers());
  }

  @Test
  void octalLookingMessageIsNotConverted() throws Exception {
    YamlLocalizationParser.Result result = parser.parse("- id: error_unknown_type\n  msg: 010\n");

    assertEquals(Optional.of("010"), result.catalog().message(DiagnosticId.of(0)));
  }

  @Test
  void structuralErrorsAreReported() {
    assertThrows(LocalizationFormatException.class, () -> parser.parse("id: error_unknown_type"));
    assertThrows(LocalizationFormatException.class, () -> parser.parse("- just a string"));
    assertThrows(LocalizationFormatException.class, () -> parser.parse("- id: error_unknown_type"));
    assertThrows(LocalizationFormatException.class,
        () -> parser.parse("- id: error_unknown_type\n  msg: [a, b]"));
    assertThrows(LocalizationFormatException.class, () -> parser.parse("- id: [unclosed"));
  }

  @Test
  void missingFileIsReported() {
    assertThrows(NoSuchFileException.class, () -> parser.parse(tempDir.resolve("absent.yaml")));
  }

  @Test
  void templateFromDefinitionsParsesBackToDefaultTexts() throws IOException {
    DiagnosticIdentifierSpace tricky = DiagnosticIdentifierSpace.of(List.of(
        new DiagnosticDefinition("quote", "say \"hi\""),
        new DiagnosticDefinition("backslash", "path C:\\temp"),
        new DiagnosticDefinition("plain", "nothing special")));
    StringWriter out = new StringWriter();
    new DefToYamlConverter(tricky.definitions()).convert(out);

    YamlLocalizationParser.Result result = new YamlLocalizationParser(tricky).parse(out.toString());

    for (int i = 0; i < tricky.size(); i++) {
      DiagnosticId id = DiagnosticId.of(i);
      assertEquals(Optional.of(tricky.defaultText(id)), result.catalog().message(id));
    }
  }

  @Test
  void templateLayoutMatchesExistingFiles() throws IOException {
    StringWriter out = new StringWriter();
    new DefToYamlConverter(List.of(new DiagnosticDefinition("A", "a \"b\" \\c"))).convert(out);

    assertEquals("- id: A\n  msg: \"a \\\"b\\\" \\\\c\"\r\n", out.toString());
  }
}
