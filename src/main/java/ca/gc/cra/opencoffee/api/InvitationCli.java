package ca.gc.cra.opencoffee.api;

import ca.gc.cra.opencoffee.application.pipeline.InvitationReport;
import ca.gc.cra.opencoffee.config.DefaultsForMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the invitation action: pair the channel members and invite each pair.
 *
 * @since 0.1.0
 */
public final class InvitationCli {
  private static final Logger log = LoggerFactory.getLogger(InvitationCli.class);
  private static final String SUMMARY_USAGE =
      "usage: opencoffee invitation [config=PATH] [key=value ...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      OpenCoffee invitation

      Usage:
        opencoffee invitation [config=PATH] [key=value ...] [flags]

      Pairs the members of slack.channelId, avoiding pairs that talked within
      slack.backtrackDays, invites every pair and stores the round under historyPath.

      Options:
        config=PATH                    YAML configuration (default config.yaml)
        generatorAlgorithm=NAME        simple | max-distance
        language=CODE                  en | it
        testMode=true|false            Open conversations but post nothing
        slack.backtrackDays=N          Recent-contact window in days (default 180)
        slack.backtrackMaxAttempts=N   Retries per member (default 3)
        Any other configuration key may be overridden the same way.

      Flags:
        --dry-run                      Print the resolved plan and exit
        --verbose                      Enable DEBUG logging
        --version                      Print the OpenCoffee version
        --help                         Show this message
      """;

  private InvitationCli() {}

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
   * Executes the invitation action and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return ActionCliSupport.execute(DefaultsForMode.INVITATION, args, HELP_TEXT, SUMMARY_USAGE, root -> {
      InvitationReport report = root.invitationUseCase().run();
      if (report.failed() > 0) {
        log.warn("{} invitations could not be delivered", report.failed());
      }
    });
  }
}
