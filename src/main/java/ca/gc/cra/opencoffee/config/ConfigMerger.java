package ca.gc.cra.opencoffee.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param action active action
   * @param yaml optional YAML-derived settings for the action
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the action
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String action,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }

    validate(action, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String action, Map<String, String> effective) {
    boolean toFile = Boolean.parseBoolean(trim(effective.get("log.toFile")).toLowerCase(Locale.ROOT));
    if (toFile && trim(effective.get("log.path")).isEmpty()) {
      throw new IllegalArgumentException("log.path is required when log.toFile=true");
    }
    if (trim(effective.get("slack.apiToken")).isEmpty()) {
      throw new IllegalArgumentException("slack.apiToken is required for " + action);
    }
    if (trim(effective.get("slack.channelId")).isEmpty()) {
      throw new IllegalArgumentException("slack.channelId is required for " + action);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
