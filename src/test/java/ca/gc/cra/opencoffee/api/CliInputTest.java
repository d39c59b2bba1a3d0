package ca.gc.cra.opencoffee.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesActionFlagsAndOverrides() {
    CliInput input = CliInput.parse(
        new String[] {"config=a.yaml", "Invitation", "--DRY-RUN", "-v", "", "testMode=true"});

    assertEquals(Optional.of("invitation"), input.command());
    assertArrayEquals(new String[] {"config=a.yaml", "testMode=true"}, input.keyValueArgs());
    assertArrayEquals(new String[] {"config=a.yaml", "--dry-run", "-v", "testMode=true"},
        input.argsWithoutCommand());
    assertTrue(input.verbose());
    assertTrue(input.dryRun());
    assertFalse(input.help());
    assertFalse(input.version());
    assertTrue(input.unknownFlags().isEmpty());
  }

  @Test
  void onlyTheFirstBareTokenIsTheAction() {
    CliInput input = CliInput.parse(new String[] {"reminder", "extra"});

    assertEquals(Optional.of("reminder"), input.command());
    assertArrayEquals(new String[] {"extra"}, input.keyValueArgs());
  }

  @Test
  void aliasesFoldIntoLongFlags() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
    assertEquals(Set.of("--help"), CliInput.parse(new String[] {"help"}).flags());
    assertTrue(CliInput.parse(new String[] {"help"}).command().isEmpty());
    assertTrue(CliInput.parse(new String[] {"--Version"}).version());
  }

  @Test
  void reportsFlagsOpenCoffeeDoesNotKnow() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "--force", "-x"});

    assertEquals(Set.of("--force", "-x"), input.unknownFlags());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.command().isEmpty());
    assertFalse(input.help());
    assertFalse(input.verbose());
    assertTrue(input.flags().isEmpty());
    assertArrayEquals(new String[0], input.keyValueArgs());
  }
}
