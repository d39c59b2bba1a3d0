package ca.gc.cra.opencoffee.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to history naming and recent-exchange windows.
 * <p><strong>Role:</strong> Lets tests pin timestamps.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.opencoffee.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
