package ca.gc.cra.opencoffee.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void redactKeepsOnlyAShortPrefix() {
    assertEquals("xoxb...[REDACTED]", Logs.redact("xoxb-1234-5678"));
    assertEquals("[REDACTED]", Logs.redact("12345678"));
    assertEquals("<null>", Logs.redact(null));
  }

  @Test
  void pluralAddsSuffixUnlessOne() {
    assertEquals("1 pair", Logs.plural(1, "pair"));
    assertEquals("0 pairs", Logs.plural(0, "pair"));
    assertEquals("3 members", Logs.plural(3, "member"));
  }
}
