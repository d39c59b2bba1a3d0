package ca.gc.cra.opencoffee.application.pipeline;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of a reminder round.
 *
 * @param source history file the pairs came from; empty when no invitation round was found
 * @param checked pairs whose recent activity was checked
 * @param reminded pairs that received the reminder
 * @param failed pairs whose reminder send failed
 * @since 0.1.0
 */
public record ReminderReport(Optional<Path> source, int checked, int reminded, int failed) {
  public ReminderReport {
    source = source == null ? Optional.empty() : source;
  }

  /** Report for a run that found no history to work from. */
  public static ReminderReport nothingToRemind() {
    return new ReminderReport(Optional.empty(), 0, 0, 0);
  }
}
