package ca.gc.cra.diagloc.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagloc.application.localization.MessageStore;
import ca.gc.cra.diagloc.application.port.LocalizationFormat;
import ca.gc.cra.diagloc.domain.diag.DiagnosticId;
import ca.gc.cra.diagloc.domain.diag.DiagnosticIdentifierSpace;
import ca.gc.cra.diagloc.infrastructure.persistence.table.SerializedTableWriter;
import ca.gc.cra.diagloc.testutil.CatalogFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MessageStoreResolverTest {
  @TempDir Path tempDir;

  private final DiagnosticIdentifierSpace identifiers = CatalogFixtures.identifiers();

  @Test
  void binaryTableWinsOverTextFormats() throws IOException {
    SerializedTableWriter writer = new SerializedTableWriter();
    writer.insert(DiagnosticId.of(0), "from db");
    assertTrue(writer.emit(tempDir.resolve("fr.db")));
    writeYaml("fr", "from yaml");
    writeStrings("fr", "from strings");

    MessageStore store = MessageStoreResolver.resolve("fr", tempDir, identifiers).orElseThrow();

    assertEquals(LocalizationFormat.SERIALIZED, store.backend().format());
    assertEquals("from db", store.message(DiagnosticId.of(0)));
  }

  @Test
  void yamlWinsOverStrings() throws IOException {
    writeYaml("fr", "from yaml");
    writeStrings("fr", "from strings");

    MessageStore store = MessageStoreResolver.resolve("fr", tempDir, identifiers).orElseThrow();

    assertEquals(LocalizationFormat.YAML, store.backend().format());
    assertEquals("from yaml", store.message(DiagnosticId.of(0)));
  }

  @Test
  void stringsUsedWhenAlone() throws IOException {
    writeStrings("de", "aus strings");

    MessageStore store = MessageStoreResolver.resolve("de", tempDir, identifiers, true).orElseThrow();

    assertEquals("aus strings [error_unknown_type]", store.message(DiagnosticId.of(0)));
  }

  @Test
  void noCatalogYieldsEmpty() {
    assertEquals(Optional.empty(), MessageStoreResolver.resolve("ja", tempDir, identifiers));
  }

  @Test
  void unreadableTableStopsResolution() throws IOException {
    Files.createDirectory(tempDir.resolve("fr.db"));
    writeYaml("fr", "from yaml");

    assertEquals(Optional.empty(), MessageStoreResolver.resolve("fr", tempDir, identifiers));
  }

  @Test
  void localeNamingAPathIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> MessageStoreResolver.resolve("../fr", tempDir, identifiers));
  }

  private void writeYaml(String locale, String text) throws IOException {
    Files.writeString(tempDir.resolve(locale + ".yaml"),
        "- id: " + CatalogFixtures.UNKNOWN_TYPE + "\n  msg: \"" + text + "\"\n");
  }

  private void writeStrings(String locale, String text) throws IOException {
    Files.writeString(tempDir.resolve(locale + ".strings"),
        "\"" + CatalogFixtures.UNKNOWN_TYPE + "\" = \"" + text + "\";\n");
  }
}
