package ca.gc.cra.opencoffee.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private static final Map<String, String> REQUIRED =
      Map.of("slack.apiToken", "xoxb-yaml", "slack.channelId", "C1");

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> yaml = Map.of("slack.apiToken", "xoxb-yaml", "slack.channelId", "C1", "language", "it");

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.INVITATION,
        Optional.of(yaml),
        Map.of("language", "en", "testMode", "true"),
        DefaultsForMode.asFlatMap(DefaultsForMode.INVITATION),
        warnings::add);

    assertEquals("en", merged.get("language"));
    assertEquals("true", merged.get("testMode"));
    assertEquals("180", merged.get("slack.backtrackDays"));
    assertEquals("xoxb-yaml", merged.get("slack.apiToken"));
    assertEquals(List.of("CLI overrides YAML for key: language"), warnings);
  }

  @Test
  void cliOnlyKeysDoNotWarn() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(DefaultsForMode.REMINDER, Optional.of(REQUIRED),
        Map.of("log.level", "DEBUG"), DefaultsForMode.asFlatMap(DefaultsForMode.REMINDER), warnings::add);

    assertTrue(warnings.isEmpty());
  }

  @Test
  void missingTokenIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(DefaultsForMode.INVITATION, Optional.empty(),
            Map.of("slack.channelId", "C1"), DefaultsForMode.asFlatMap(DefaultsForMode.INVITATION), null));

    assertTrue(ex.getMessage().contains("slack.apiToken"));
  }

  @Test
  void missingChannelIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(DefaultsForMode.REMINDER, Optional.empty(),
            Map.of("slack.apiToken", "xoxb"), DefaultsForMode.asFlatMap(DefaultsForMode.REMINDER), null));
  }

  @Test
  void fileLoggingRequiresAPath() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(DefaultsForMode.INVITATION, Optional.of(REQUIRED),
            Map.of("log.toFile", "true", "log.path", " "), Map.of(), null));
  }
}
