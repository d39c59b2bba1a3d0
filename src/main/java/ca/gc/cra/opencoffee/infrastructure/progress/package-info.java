/**
 * <strong>Purpose:</strong> Progress reporting adapters for long-running steps such as pair generation and sends.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.infrastructure.progress;
