/**
 * <strong>Purpose:</strong> Use cases for the two actions of a coffee round: invitation and reminder.
 * <p><strong>Pipeline role:</strong> Orchestrates ports; built by {@code CompositionRoot} and run by the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.application.pipeline;
