package ca.gc.cra.opencoffee.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads OpenCoffee configuration from a YAML document and flattens it into key/value pairs.
 *
 * <p>Layout:</p>
 * <pre>
 * common:            # unprefixed keys: language, testMode, historyPath, generatorAlgorithm
 * log:               # log.* keys
 * slack:             # slack.* keys; lists such as ignoreUsers are joined with commas
 * invitation:        # optional per-action overrides, same shape as the root
 * reminder:
 * </pre>
 */
public final class YamlConfigLoader {
  private static final List<String> PREFIXED_SECTIONS = List.of("log", "slack");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} for one action.
   *
   * @param path location of the YAML configuration
   * @param action action whose override section applies ({@code invitation} or {@code reminder})
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String action) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(action, "action");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedAction = action.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      flattenSections(root, "", flattened);
      Object actionSection = findSection(root, normalizedAction);
      if (actionSection != null) {
        flattenSections(asMap(actionSection, normalizedAction), normalizedAction, flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static void flattenSections(Map<String, Object> root, String context, Map<String, String> target) {
    Object common = findSection(root, "common");
    if (common != null) {
      flatten(asMap(common, qualify(context, "common")), "", target);
    }
    for (String section : PREFIXED_SECTIONS) {
      Object node = findSection(root, section);
      if (node != null) {
        flatten(asMap(node, qualify(context, section)), section, target);
      }
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = qualify(prefix, key.trim());
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joiner = new StringJoiner(",");
    for (Object item : items) {
      if (item == null) {
        continue;
      }
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list " + key + " must only contain scalar values");
      }
      String text = item.toString();
      if (text.contains(",")) {
        throw new IllegalArgumentException("YAML list " + key + " contains a value with a comma: " + text);
      }
      joiner.add(text);
    }
    return joiner.toString();
  }

  private static String qualify(String prefix, String key) {
    return prefix.isEmpty() ? key : prefix + '.' + key;
  }
}
