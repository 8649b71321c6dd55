package ca.gc.cra.diagloc.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsValue() {
    assertEquals("fr", Strings.requireNonBlank("locale", "  fr "));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("locale", "   "));
    assertEquals("locale must not be blank", ex.getMessage());
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("id", "a\u0007b"));
  }

  @Test
  void requireNonBlankRejectsNull() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("id", null));
  }

  @Test
  void containsControlDetectsTabs() {
    assertTrue(Strings.containsControl("a\tb"));
    assertFalse(Strings.containsControl("plain"));
  }
}
