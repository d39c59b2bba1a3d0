package ca.gc.cra.opencoffee.infrastructure.progress;

import ca.gc.cra.opencoffee.application.port.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProgressListener} that reports step progress through SLF4J.
 *
 * <p>Logs at INFO when a step starts and finishes, and at DEBUG every time another tenth of the step completes.</p>
 *
 * @since 0.1.0
 */
public final class LoggingProgressListener implements ProgressListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

  private String step = "";
  private int total;
  private int done;
  private int lastDecile;

  @Override
  public void start(String step, int total) {
    this.step = step == null ? "" : step;
    this.total = Math.max(0, total);
    this.done = 0;
    this.lastDecile = 0;
    log.info("{}: started ({} to process)", this.step, this.total);
  }

  @Override
  public void advance(int units) {
    if (units <= 0) {
      return;
    }
    done = Math.min(total, done + units);
    if (total == 0) {
      return;
    }
    int decile = done * 10 / total;
    if (decile > lastDecile) {
      lastDecile = decile;
      log.debug("{}: {}/{} ({}%)", step, done, total, done * 100 / total);
    }
  }

  @Override
  public void finish() {
    log.info("{}: finished ({}/{})", step, done, total);
  }

  int done() {
    return done;
  }
}
