package ca.gc.cra.opencoffee.application.message;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.Set;

/**
 * Localized texts posted to pairs, backed by the {@code messages} resource bundle.
 *
 * <p>Supported languages: {@code en} (base bundle) and {@code it}.</p>
 *
 * @since 0.1.0
 */
public final class MessageCatalog {
  /** Languages with a bundle on the classpath. */
  public static final Set<String> SUPPORTED_LANGUAGES = Set.of("en", "it");

  private static final String BUNDLE = "messages";

  private final Locale locale;
  private final ResourceBundle bundle;

  /**
   * Loads the bundle for a language.
   *
   * @param locale language to load; must not be {@code null}
   * @throws IllegalArgumentException if the language is not supported
   */
  public MessageCatalog(Locale locale) {
    this.locale = Objects.requireNonNull(locale, "locale");
    if (!SUPPORTED_LANGUAGES.contains(locale.getLanguage())) {
      throw new IllegalArgumentException("Unsupported language: " + locale.getLanguage());
    }
    // The JVM default locale must not leak in as a fallback for "en".
    ResourceBundle.Control control =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);
    this.bundle = ResourceBundle.getBundle(BUNDLE, locale, MessageCatalog.class.getClassLoader(), control);
  }

  /**
   * Returns the catalog language.
   *
   * @return locale
   */
  public Locale locale() {
    return locale;
  }

  /**
   * Formats the invitation text.
   *
   * @param channelId channel whose members are being paired
   * @return invitation text mentioning the channel
   */
  public String invitation(String channelId) {
    return format("invitation.text", channelId);
  }

  /**
   * Returns the reminder text.
   *
   * @return reminder text
   */
  public String reminder() {
    return format("reminder.text");
  }

  private String format(String key, Object... args) {
    String pattern;
    try {
      pattern = bundle.getString(key);
    } catch (MissingResourceException ex) {
      throw new IllegalStateException("Missing message key " + key + " for " + locale, ex);
    }
    return new MessageFormat(pattern, locale).format(args);
  }
}
