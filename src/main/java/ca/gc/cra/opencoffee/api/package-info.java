/**
 * <strong>Purpose:</strong> Command-line entry points: the {@code opencoffee} dispatcher and its
 * {@code invitation} and {@code reminder} commands.
 * <p><strong>Pipeline role:</strong> Parses {@code key=value} arguments, resolves configuration and maps
 * outcomes to {@link ca.gc.cra.opencoffee.api.ExitCode}s.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.api;
