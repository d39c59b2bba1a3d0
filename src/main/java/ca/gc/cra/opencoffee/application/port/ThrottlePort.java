package ca.gc.cra.opencoffee.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Port pacing successive remote calls to stay under the chat service rate limits.
 * <p><strong>Role:</strong> Injected into strategies, use cases and adapters that issue back-to-back requests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @implNote Pacing never changes results; {@link #NONE} is used by tests.
 * @since 0.1.0
 * @see ca.gc.cra.opencoffee.infrastructure.time.SleepingThrottleAdapter
 */
public interface ThrottlePort {

  /**
   * Blocks the caller for {@code delay}.
   *
   * @param delay pause length; zero or negative values return immediately
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  void pause(Duration delay) throws InterruptedException;

  /** Throttle that never waits. */
  ThrottlePort NONE = delay -> {};
}
