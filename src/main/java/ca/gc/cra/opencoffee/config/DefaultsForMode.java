package ca.gc.cra.opencoffee.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each OpenCoffee action.
 *
 * <p>The defaults are the single source of truth for optional keys; {@code slack.apiToken} and
 * {@code slack.channelId} have no default.</p>
 */
public final class DefaultsForMode {
  /** Action sending invitations to new pairs. */
  public static final String INVITATION = "invitation";
  /** Action sending reminders to the latest pairs. */
  public static final String REMINDER = "reminder";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested action.
   *
   * @param action {@code invitation} or {@code reminder}
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown action
   */
  public static Map<String, String> asFlatMap(String action) {
    Objects.requireNonNull(action, "action");
    String normalized = action.trim().toLowerCase(Locale.ROOT);
    if (!INVITATION.equals(normalized) && !REMINDER.equals(normalized)) {
      throw new IllegalArgumentException("Unsupported action: " + action);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.put("dryRun", "false");
    return Map.copyOf(defaults);
  }

  static Map<String, String> commonDefaults() {
    return COMMON_DEFAULTS;
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("language", "en");
    map.put("testMode", "false");
    map.put("historyPath", "./logs/history/");
    map.put("generatorAlgorithm", "simple");
    map.put("log.toFile", "false");
    map.put("log.path", "./logs/");
    map.put("log.level", "INFO");
    map.put("slack.ignoreUsers", "");
    map.put("slack.backtrackDays", "180");
    map.put("slack.backtrackMaxAttempts", "3");
    map.put("slack.apiBaseUrl", "https://slack.com/api/");
    map.put("slack.callDelayMillis", "500");
    map.put("slack.sendDelayMillis", "250");
    return Map.copyOf(map);
  }
}
