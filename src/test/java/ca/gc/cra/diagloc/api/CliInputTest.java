package ca.gc.cra.diagloc.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"id=x", "--Debug-Names", "-v", "-n", " ", "locale=fr"});

    assertArrayEquals(new String[] {"id=x", "locale=fr"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--debug-names"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognizesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
