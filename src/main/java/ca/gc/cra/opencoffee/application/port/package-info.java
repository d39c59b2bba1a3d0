/**
 * <strong>Purpose:</strong> Ports through which OpenCoffee use cases reach the chat service, the history store,
 * the clock and progress reporting.
 * <p><strong>Concurrency:</strong> A run drives every port from one thread.
 * <p><strong>Observability:</strong> Adapters log through SLF4J; ports carry no logging contract.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.application.port;
