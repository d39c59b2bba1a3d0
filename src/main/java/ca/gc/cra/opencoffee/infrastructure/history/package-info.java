/**
 * <strong>Purpose:</strong> File-based pair history written by invitation runs and read back by reminder runs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.infrastructure.history;
