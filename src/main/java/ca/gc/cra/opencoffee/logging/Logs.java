package ca.gc.cra.opencoffee.logging;

/**
 * <strong>What:</strong> Small helpers that keep log lines readable and free of secrets.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int VISIBLE_PREFIX = 4;

  private Logs() {
    // Utility
  }

  /**
   * Masks a credential, keeping only a short prefix so operators can tell tokens apart.
   *
   * <p>Values of eight characters or fewer are fully redacted.</p>
   *
   * @param value secret to mask; {@code null} yields {@code "<null>"}
   * @return masked representation
   */
  public static String redact(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (value.length() <= VISIBLE_PREFIX * 2) {
      return REDACTED_PLACEHOLDER;
    }
    return value.substring(0, VISIBLE_PREFIX) + "..." + REDACTED_PLACEHOLDER;
  }

  /**
   * Formats a count with a singular or plural noun, for example {@code "1 pair"} or {@code "3 pairs"}.
   *
   * @param count number of items
   * @param singular noun used when {@code count == 1}; the plural appends {@code s}
   * @return formatted count
   */
  public static String plural(int count, String singular) {
    return count + " " + (count == 1 ? singular : singular + "s");
  }
}
