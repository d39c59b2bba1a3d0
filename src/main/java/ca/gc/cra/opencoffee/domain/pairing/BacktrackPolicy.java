package ca.gc.cra.opencoffee.domain.pairing;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Bounded retry policy applied when a candidate partner was contacted recently.
 * <p><strong>Role:</strong> Configuration value handed to every pairing strategy.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param backtrackDays window, in days, searched for a recent exchange between two members; {@code >= 0}
 * @param maxAttempts retries allowed after the first eligibility check for a member; {@code >= 0}
 * @param retryDelay pause before each retry check; {@link Duration#ZERO} disables pacing
 * @since 0.1.0
 */
public record BacktrackPolicy(int backtrackDays, int maxAttempts, Duration retryDelay) {

  /** Default delay between retry checks. */
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(500);

  /**
   * Validates ranges.
   *
   * @throws IllegalArgumentException if a count is negative or the delay is negative
   */
  public BacktrackPolicy {
    if (backtrackDays < 0) {
      throw new IllegalArgumentException("backtrackDays must be >= 0 (was " + backtrackDays + ")");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0 (was " + maxAttempts + ")");
    }
    retryDelay = Objects.requireNonNullElse(retryDelay, Duration.ZERO);
    if (retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must not be negative");
    }
  }

  /**
   * Creates a policy without pacing between retries.
   *
   * @param backtrackDays recent-exchange window in days
   * @param maxAttempts retry budget
   * @return policy with {@link Duration#ZERO} delay
   */
  public static BacktrackPolicy withoutDelay(int backtrackDays, int maxAttempts) {
    return new BacktrackPolicy(backtrackDays, maxAttempts, Duration.ZERO);
  }
}
