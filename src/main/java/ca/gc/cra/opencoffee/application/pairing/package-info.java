/**
 * <strong>Purpose:</strong> Pair generation: the strategy contract, the simple and max-distance algorithms, and the
 * channel-based distance matrix builder.
 * <p><strong>Concurrency:</strong> Single-threaded; one remote call outstanding at a time.
 * <p><strong>Observability:</strong> DEBUG logs per member decision; progress via
 * {@link ca.gc.cra.opencoffee.application.port.ProgressListener}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.application.pairing;
