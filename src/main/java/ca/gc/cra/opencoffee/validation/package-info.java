/**
 * <strong>Purpose:</strong> Input validation shared by configuration and CLI parsing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.validation;
