/**
 * <strong>Purpose:</strong> Pairing domain values: members, rosters, pairs, distance matrices and results.
 * <p><strong>Concurrency:</strong> Values are immutable except {@link ca.gc.cra.opencoffee.domain.pairing.DistanceMatrix}
 * while it is being built.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.domain.pairing;
