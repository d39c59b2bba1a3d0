package ca.gc.cra.opencoffee.api;

import ca.gc.cra.opencoffee.application.pipeline.ReminderReport;
import ca.gc.cra.opencoffee.config.DefaultsForMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the reminder action: nudge the latest pairs that have not talked yet.
 *
 * @since 0.1.0
 */
public final class ReminderCli {
  private static final Logger log = LoggerFactory.getLogger(ReminderCli.class);
  private static final String SUMMARY_USAGE =
      "usage: opencoffee reminder [config=PATH] [key=value ...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      OpenCoffee reminder

      Usage:
        opencoffee reminder [config=PATH] [key=value ...] [flags]

      Loads the latest round stored for this configuration and sends the reminder
      to every pair whose conversation has fewer than five messages.

      Options:
        config=PATH                    YAML configuration (default config.yaml)
        language=CODE                  en | it
        testMode=true|false            Use the test-mode history and post nothing
        Any other configuration key may be overridden as key=value.

      Flags:
        --dry-run                      Print the resolved plan and exit
        --verbose                      Enable DEBUG logging
        --version                      Print the OpenCoffee version
        --help                         Show this message
      """;

  private ReminderCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the reminder action and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return ActionCliSupport.execute(DefaultsForMode.REMINDER, args, HELP_TEXT, SUMMARY_USAGE, root -> {
      ReminderReport report = root.reminderUseCase().run();
      if (report.source().isEmpty()) {
        log.info("Nothing to remind");
      }
    });
  }
}
