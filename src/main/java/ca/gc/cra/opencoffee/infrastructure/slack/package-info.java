/**
 * <strong>Purpose:</strong> Slack Web API adapter implementing the group communication port.
 * <p><strong>Security:</strong> The bot token is sent as a bearer header and never logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.infrastructure.slack;
