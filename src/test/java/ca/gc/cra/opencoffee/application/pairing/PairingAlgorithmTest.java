package ca.gc.cra.opencoffee.application.pairing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class PairingAlgorithmTest {

  @Test
  void parsesConfigValues() {
    assertEquals(PairingAlgorithm.SIMPLE, PairingAlgorithm.fromString("simple"));
    assertEquals(PairingAlgorithm.MAX_DISTANCE, PairingAlgorithm.fromString("max-distance"));
    assertEquals(PairingAlgorithm.MAX_DISTANCE, PairingAlgorithm.fromString(" MAX_DISTANCE "));
    assertEquals(PairingAlgorithm.SIMPLE, PairingAlgorithm.fromString(null));
    assertEquals(PairingAlgorithm.SIMPLE, PairingAlgorithm.fromString(""));
  }

  @Test
  void rejectsUnknownAlgorithm() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> PairingAlgorithm.fromString("round-robin"));
    assertEquals("Unknown generatorAlgorithm: round-robin", ex.getMessage());
  }

  @Test
  void factoryCreatesMatchingStrategy() {
    for (PairingAlgorithm algorithm : PairingAlgorithm.values()) {
      PairingStrategy strategy = PairingStrategies.create(
          algorithm, new Random(1), ThrottlePort.NONE, Duration.ZERO, ProgressListener.NO_OP);
      assertEquals(algorithm, strategy.algorithm());
    }
    assertInstanceOf(MaxDistancePairingStrategy.class, PairingStrategies.create(
        PairingAlgorithm.MAX_DISTANCE, new Random(1), ThrottlePort.NONE, Duration.ZERO, ProgressListener.NO_OP));
  }
}
