/**
 * <strong>Purpose:</strong> Logging bootstrap and log hygiene helpers.
 * <p><strong>Pipeline role:</strong> Invoked once by the CLI before any use case runs.
 * <p><strong>Security:</strong> Tokens pass through {@link ca.gc.cra.opencoffee.logging.Logs#redact(String)} before logging.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.logging;
