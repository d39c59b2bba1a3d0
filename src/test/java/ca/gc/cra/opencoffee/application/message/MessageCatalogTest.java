package ca.gc.cra.opencoffee.application.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class MessageCatalogTest {

  @Test
  void englishInvitationMentionsTheChannel() {
    MessageCatalog catalog = new MessageCatalog(Locale.ENGLISH);

    String text = catalog.invitation("C0123");

    assertTrue(text.contains("<#C0123>"), text);
    assertTrue(text.contains("\n"), "invitation spans two lines");
    assertFalse(text.contains("{0}"));
  }

  @Test
  void italianTextsComeFromTheItalianBundle() {
    MessageCatalog catalog = new MessageCatalog(Locale.ITALIAN);

    assertTrue(catalog.invitation("C9").startsWith(":wave: ciao"));
    assertTrue(catalog.invitation("C9").contains("<#C9>"));
    assertTrue(catalog.reminder().contains("ciao"));
    assertEquals(Locale.ITALIAN, catalog.locale());
  }

  @Test
  void englishDoesNotFallBackToTheDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.ITALIAN);
    try {
      assertTrue(new MessageCatalog(Locale.ENGLISH).reminder().contains("have you had the chance"));
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void rejectsUnsupportedLanguage() {
    assertThrows(IllegalArgumentException.class, () -> new MessageCatalog(Locale.FRENCH));
  }
}
