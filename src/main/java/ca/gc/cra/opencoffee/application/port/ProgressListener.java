package ca.gc.cra.opencoffee.application.port;

/**
 * <strong>What:</strong> Port receiving incremental progress of a long-running step.
 * <p><strong>Role:</strong> Observability hook for pairing and message sending; never affects results.</p>
 * <p><strong>Thread-safety:</strong> Invoked from the thread running the step.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.opencoffee.infrastructure.progress.LoggingProgressListener
 */
public interface ProgressListener {

  /**
   * Signals the start of a step.
   *
   * @param step short label (e.g. {@code "Generate pairs"})
   * @param total number of units the step will report
   */
  void start(String step, int total);

  /**
   * Reports completed units.
   *
   * @param units number of units completed since the previous call; {@code 0} is allowed
   */
  void advance(int units);

  /** Signals the end of the current step. */
  void finish();

  /** Listener that ignores all updates. */
  ProgressListener NO_OP = new ProgressListener() {
    @Override public void start(String step, int total) {}

    @Override public void advance(int units) {}

    @Override public void finish() {}
  };
}
