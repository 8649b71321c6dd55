package ca.gc.cra.diagloc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"locale=fr", "dir=a=b", " id = x "});

    assertEquals("fr", map.get("locale"));
    assertEquals("a=b", map.get("dir"));
    assertEquals("x", map.get("id"));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMissingValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"locale="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"locale"}));
  }

  @Test
  void rejectsInvalidKeyCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"lo cale=fr"}));
  }

  @Test
  void rejectsControlCharactersInValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"id=a\u0001b"}));
  }
}
