package ca.gc.cra.opencoffee.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {
  static final String DEFAULT_CONFIG_FILE = "config.yaml";

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=PATH} from the CLI map and returns it, falling back to {@value #DEFAULT_CONFIG_FILE}.
   */
  static Path extractConfigPath(Map<String, String> args) {
    String value = args == null ? null : args.remove("config");
    if (value == null || value.isBlank()) {
      return Path.of(DEFAULT_CONFIG_FILE);
    }
    return Path.of(value.trim());
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
