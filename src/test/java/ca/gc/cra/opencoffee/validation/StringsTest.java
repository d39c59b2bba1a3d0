package ca.gc.cra.opencoffee.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireIdentifierAcceptsSlackIds() {
    assertEquals("C0123ABC", Strings.requireIdentifier("slack.channelId", " C0123ABC "));
  }

  @Test
  void requireIdentifierRejectsInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("slack.channelId", "#general"));
  }

  @Test
  void splitListTrimsAndDropsEmptyItems() {
    assertEquals(List.of("U1", "U2"), Strings.splitList(" U1, ,U2,"));
    assertTrue(Strings.splitList(null).isEmpty());
    assertTrue(Strings.splitList("  ").isEmpty());
  }
}
