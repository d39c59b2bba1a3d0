package ca.gc.cra.opencoffee.application.pairing;

import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Factory creating the {@link PairingStrategy} for a configured {@link PairingAlgorithm}.
 *
 * @since 0.1.0
 */
public final class PairingStrategies {

  private PairingStrategies() {}

  /**
   * Creates a strategy.
   *
   * @param algorithm selected algorithm; must not be {@code null}
   * @param random random source shared by shuffles and draws; must not be {@code null}
   * @param throttle pacing for remote calls; must not be {@code null}
   * @param callDelay pause between channel-scan calls (max-distance only)
   * @param progress progress listener; must not be {@code null}
   * @return strategy instance
   */
  public static PairingStrategy create(
      PairingAlgorithm algorithm,
      Random random,
      ThrottlePort throttle,
      Duration callDelay,
      ProgressListener progress) {
    Objects.requireNonNull(algorithm, "algorithm");
    return switch (algorithm) {
      case SIMPLE -> new SimplePairingStrategy(random, throttle, progress);
      case MAX_DISTANCE -> new MaxDistancePairingStrategy(
          random, throttle, progress, new DistanceMatrixBuilder(throttle, callDelay, progress));
    };
  }
}
