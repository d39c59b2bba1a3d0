package ca.gc.cra.opencoffee.application.port;

import java.util.Optional;

/**
 * Checked exception raised when a call to the group communication service fails.
 *
 * @since 0.1.0
 */
public final class CommunicationException extends Exception {
  private final String errorCode;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public CommunicationException(String msg) {
    this(msg, null, null);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause transport or parsing failure
   */
  public CommunicationException(String msg, Throwable cause) {
    this(msg, null, cause);
  }

  /**
   * Creates an exception carrying the service-specific error code.
   *
   * @param msg human-readable error
   * @param errorCode error code reported by the remote service (e.g. {@code channel_not_found}); may be {@code null}
   * @param cause underlying failure; may be {@code null}
   */
  public CommunicationException(String msg, String errorCode, Throwable cause) {
    super(msg, cause);
    this.errorCode = errorCode;
  }

  /**
   * Returns the error code reported by the remote service, when one was available.
   *
   * @return optional error code
   */
  public Optional<String> errorCode() {
    return Optional.ofNullable(errorCode);
  }
}
