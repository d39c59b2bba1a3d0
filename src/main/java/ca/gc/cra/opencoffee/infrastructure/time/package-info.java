/**
 * <strong>Purpose:</strong> Time adapters: the system clock and the sleeping throttle used to pace chat API calls.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.infrastructure.time;
