package ca.gc.cra.opencoffee.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "config=team.yaml", " slack.backtrackDays = 30 ", "slack.apiBaseUrl=http://localhost:8080/api?x=1"});

    assertEquals("team.yaml", map.get("config"));
    assertEquals("30", map.get("slack.backtrackDays"));
    assertEquals("http://localhost:8080/api?x=1", map.get("slack.apiBaseUrl"));
  }

  @Test
  void laterValuesWin() {
    assertEquals("it", CliArgsParser.toMap(new String[] {"language=en", "language=it"}).get("language"));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, " "}).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"language"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=en"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"language="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1st=x"}));
  }
}
