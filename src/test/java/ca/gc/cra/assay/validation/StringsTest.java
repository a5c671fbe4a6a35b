package ca.gc.cra.assay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonEmptyKeepsWhitespace() {
    assertEquals(" - ", Strings.requireNonEmpty("sep", " - "));
    assertEquals("\n\t", Strings.requireNonEmpty("sep", "\n\t"));
  }

  @Test
  void requireNonEmptyRejectsEmptyAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonEmpty("sep", ""));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonEmpty("sep", "a\u0000"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonEmpty("sep", null));
  }

  @Test
  void parseBooleanIsStrict() {
    assertTrue(Strings.parseBoolean("flag", " TRUE ", false));
    assertFalse(Strings.parseBoolean("flag", "false", true));
    assertTrue(Strings.parseBoolean("flag", null, true));
    assertThrows(IllegalArgumentException.class, () -> Strings.parseBoolean("flag", "yes", false));
  }
}
