package ca.gc.cra.opencoffee.config;

import ca.gc.cra.opencoffee.application.message.MessageCatalog;
import ca.gc.cra.opencoffee.application.pairing.PairingAlgorithm;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.validation.Numbers;
import ca.gc.cra.opencoffee.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validated settings of an OpenCoffee run.
 * <p><strong>Role:</strong> Configuration aggregate built from the merged key/value map
 * (defaults, YAML and CLI overrides) and consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse and range-check every {@code common}, {@code log.*} and {@code slack.*} key.</li>
 *   <li>Fail with an {@link IllegalArgumentException} naming the offending key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param language message language
 * @param testMode when {@code true}, nothing is posted and history files carry a test marker
 * @param historyPath directory holding pair history files
 * @param algorithm pairing algorithm
 * @param log logging settings
 * @param slack Slack settings
 * @since 0.1.0
 */
public record OpenCoffeeConfig(
    Locale language,
    boolean testMode,
    Path historyPath,
    PairingAlgorithm algorithm,
    LogSettings log,
    SlackSettings slack) {

  static final int MAX_BACKTRACK_DAYS = 3650;
  static final int MAX_ATTEMPTS = 1000;
  static final int MAX_DELAY_MILLIS = 60_000;

  public OpenCoffeeConfig {
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(historyPath, "historyPath");
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(log, "log");
    Objects.requireNonNull(slack, "slack");
  }

  /**
   * Builds a configuration from a flat key/value map; missing optional keys take their defaults.
   *
   * @param options merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing, malformed or out of range
   */
  public static OpenCoffeeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = DefaultsForMode.commonDefaults();

    String languageRaw = value(options, defaults, "language").toLowerCase(Locale.ROOT);
    if (!MessageCatalog.SUPPORTED_LANGUAGES.contains(languageRaw)) {
      throw new IllegalArgumentException(
          "language must be one of " + MessageCatalog.SUPPORTED_LANGUAGES + " (was '" + languageRaw + "')");
    }
    boolean testMode = parseBoolean("testMode", value(options, defaults, "testMode"));
    Path historyPath = parsePath("historyPath", value(options, defaults, "historyPath"));
    PairingAlgorithm algorithm = PairingAlgorithm.fromString(value(options, defaults, "generatorAlgorithm"));

    LogSettings log = new LogSettings(
        parseBoolean("log.toFile", value(options, defaults, "log.toFile")),
        parsePath("log.path", value(options, defaults, "log.path")),
        normalizeLevel(value(options, defaults, "log.level")));

    String token = options.get("slack.apiToken");
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("slack.apiToken is required");
    }
    String channel = options.get("slack.channelId");
    if (channel == null || channel.isBlank()) {
      throw new IllegalArgumentException("slack.channelId is required");
    }
    Set<String> ignoreUsers = new LinkedHashSet<>();
    for (String user : Strings.splitList(options.get("slack.ignoreUsers"))) {
      ignoreUsers.add(Strings.requireIdentifier("slack.ignoreUsers", user));
    }
    SlackSettings slack = new SlackSettings(
        Strings.requireNonBlank("slack.apiToken", token),
        Strings.requireIdentifier("slack.channelId", channel),
        ignoreUsers,
        Numbers.parseInt("slack.backtrackDays", value(options, defaults, "slack.backtrackDays"),
            0, MAX_BACKTRACK_DAYS),
        Numbers.parseInt("slack.backtrackMaxAttempts", value(options, defaults, "slack.backtrackMaxAttempts"),
            0, MAX_ATTEMPTS),
        parseUri("slack.apiBaseUrl", value(options, defaults, "slack.apiBaseUrl")),
        Duration.ofMillis(Numbers.parseInt("slack.callDelayMillis",
            value(options, defaults, "slack.callDelayMillis"), 0, MAX_DELAY_MILLIS)),
        Duration.ofMillis(Numbers.parseInt("slack.sendDelayMillis",
            value(options, defaults, "slack.sendDelayMillis"), 0, MAX_DELAY_MILLIS)));

    return new OpenCoffeeConfig(Locale.forLanguageTag(languageRaw), testMode, historyPath, algorithm, log, slack);
  }

  /**
   * Returns the recent-contact policy derived from the Slack settings.
   *
   * @return backtrack policy using the call delay between retries
   */
  public BacktrackPolicy backtrackPolicy() {
    return new BacktrackPolicy(slack.backtrackDays(), slack.backtrackMaxAttempts(), slack.callDelay());
  }

  /**
   * Maps a level name or a numeric level (10 DEBUG, 20 INFO, 30 WARN, 40 ERROR, 50 ERROR) to a Logback level name.
   *
   * @param raw configured level
   * @return one of {@code TRACE}, {@code DEBUG}, {@code INFO}, {@code WARN}, {@code ERROR}, {@code OFF}
   * @throws IllegalArgumentException when the level is not recognized
   */
  static String normalizeLevel(String raw) {
    String level = Strings.requireNonBlank("log.level", raw).toUpperCase(Locale.ROOT);
    switch (level) {
      case "TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF":
        return level;
      case "WARNING", "30":
        return "WARN";
      case "CRITICAL", "FATAL", "40", "50":
        return "ERROR";
      case "10":
        return "DEBUG";
      case "20":
        return "INFO";
      default:
        throw new IllegalArgumentException("log.level is not a known level: " + raw);
    }
  }

  private static String value(Map<String, String> options, Map<String, String> defaults, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaults.get(key);
    }
    return value.trim();
  }

  private static boolean parseBoolean(String name, String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "true", "yes", "on", "1":
        return true;
      case "false", "no", "off", "0":
        return false;
      default:
        throw new IllegalArgumentException(name + " must be true or false (was '" + value + "')");
    }
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static URI parseUri(String name, String value) {
    try {
      URI uri = new URI(Strings.requireNonBlank(name, value));
      String scheme = uri.getScheme();
      if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(name + " must be an http or https URL: " + value);
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + value, ex);
    }
  }

  /**
   * Logging settings.
   *
   * @param toFile whether a rolling log file is written
   * @param path directory of the log file
   * @param level Logback level name
   */
  public record LogSettings(boolean toFile, Path path, String level) {
    public LogSettings {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(level, "level");
    }
  }

  /**
   * Slack settings.
   *
   * @param apiToken bot token
   * @param channelId channel whose members are paired
   * @param ignoreUsers users excluded from pairing and channel scans
   * @param backtrackDays recent-contact window in days
   * @param backtrackMaxAttempts retries allowed per member after the first check
   * @param apiBaseUrl Web API root
   * @param callDelay pause between discovery and check calls
   * @param sendDelay pause between message sends
   */
  public record SlackSettings(
      String apiToken,
      String channelId,
      Set<String> ignoreUsers,
      int backtrackDays,
      int backtrackMaxAttempts,
      URI apiBaseUrl,
      Duration callDelay,
      Duration sendDelay) {
    public SlackSettings {
      Objects.requireNonNull(apiToken, "apiToken");
      Objects.requireNonNull(channelId, "channelId");
      ignoreUsers = Set.copyOf(Objects.requireNonNull(ignoreUsers, "ignoreUsers"));
      Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
      Objects.requireNonNull(callDelay, "callDelay");
      Objects.requireNonNull(sendDelay, "sendDelay");
    }

    @Override
    public String toString() {
      return "SlackSettings[channelId=" + channelId + ", ignoreUsers=" + ignoreUsers.size()
          + ", backtrackDays=" + backtrackDays + ", backtrackMaxAttempts=" + backtrackMaxAttempts
          + ", apiBaseUrl=" + apiBaseUrl + "]";
    }
  }
}
