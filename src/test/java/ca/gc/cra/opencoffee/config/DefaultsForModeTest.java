package ca.gc.cra.opencoffee.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void bothActionsShareTheCommonDefaults() {
    Map<String, String> invitation = DefaultsForMode.asFlatMap("invitation");
    Map<String, String> reminder = DefaultsForMode.asFlatMap(" REMINDER ");

    assertEquals(invitation, reminder);
    assertEquals("en", invitation.get("language"));
    assertEquals("simple", invitation.get("generatorAlgorithm"));
    assertEquals("180", invitation.get("slack.backtrackDays"));
    assertEquals("3", invitation.get("slack.backtrackMaxAttempts"));
    assertEquals("false", invitation.get("dryRun"));
    assertFalse(invitation.containsKey("slack.apiToken"));
  }

  @Test
  void unknownActionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
