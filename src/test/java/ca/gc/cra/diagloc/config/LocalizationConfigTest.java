package ca.gc.cra.diagloc.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LocalizationConfigTest {

  @Test
  void fromMapParsesAllKeys() {
    LocalizationConfig config = LocalizationConfig.fromMap(Map.of(
        "dir", "/srv/l10n",
        "locale", " pt-BR ",
        "defs", "defs.yaml",
        "debugNames", "TRUE"));

    assertEquals(Path.of("/srv/l10n"), config.directory());
    assertEquals("pt-BR", config.locale());
    assertEquals(Path.of("defs.yaml"), config.definitions());
    assertTrue(config.printDiagnosticNames());
  }

  @Test
  void fromMapAppliesDefaults() {
    LocalizationConfig config = LocalizationConfig.fromMap(Map.of("defs", "defs.yaml"));

    assertEquals(LocalizationConfig.DEFAULT_DIRECTORY, config.directory());
    assertEquals("en", config.locale());
    assertFalse(config.printDiagnosticNames());
  }

  @Test
  void definitionsAreRequired() {
    assertThrows(IllegalArgumentException.class, () -> LocalizationConfig.fromMap(Map.of("locale", "fr")));
  }

  @Test
  void localeMustNotNamePaths() {
    assertThrows(IllegalArgumentException.class, () -> LocalizationConfig.requireLocaleTag("../fr"));
    assertThrows(IllegalArgumentException.class, () -> LocalizationConfig.requireLocaleTag("a\\b"));
    assertThrows(IllegalArgumentException.class, () -> LocalizationConfig.requireLocaleTag(".."));
    assertThrows(IllegalArgumentException.class, () -> LocalizationConfig.requireLocaleTag(" "));
  }
}
