package ca.gc.cra.opencoffee.infrastructure.time;

import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import java.time.Duration;

/**
 * {@link ThrottlePort} that pauses the calling thread with {@link Thread#sleep(long)}.
 *
 * @since 0.1.0
 */
public final class SleepingThrottleAdapter implements ThrottlePort {

  /**
   * Sleeps for {@code delay}; zero, negative or {@code null} delays return immediately.
   *
   * @param delay pause length
   * @throws InterruptedException if interrupted while sleeping
   */
  @Override
  public void pause(Duration delay) throws InterruptedException {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return;
    }
    Thread.sleep(delay.toMillis());
  }
}
