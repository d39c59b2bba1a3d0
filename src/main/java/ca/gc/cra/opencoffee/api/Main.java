package ca.gc.cra.opencoffee.api;

import ca.gc.cra.opencoffee.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenCoffee CLI dispatcher that routes to the action subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String VERSION_RESOURCE = "/opencoffee-version.properties";
  private static final String SUMMARY_USAGE = "usage: opencoffee <invitation|reminder> [options]";
  private static final String HELP_TEXT = """
      OpenCoffee: random coffee chats for Slack channel members

      Usage:
        opencoffee <command> [options]

      Commands:
        invitation  Pair channel members and invite each pair (invitation --help for details)
        reminder    Remind the latest pairs that have not talked yet

      Global flags:
        --help      Show this message
        --version   Print the OpenCoffee version
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

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
   * Routes the command line to the selected action without exiting the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code of the action, or of the dispatcher when no action could be selected
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.command().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (input.version()) {
        printVersion();
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = input.command().get();
    return switch (command) {
      case "invitation" -> InvitationCli.run(input.argsWithoutCommand());
      case "reminder" -> ReminderCli.run(input.argsWithoutCommand());
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  static void printVersion() {
    CliPrinter.println("opencoffee " + version());
  }

  /**
   * Resolves the project version from the build-filtered properties file, then from the jar manifest.
   *
   * @return version string, or {@code unknown}
   */
  static String version() {
    try (InputStream in = Main.class.getResourceAsStream(VERSION_RESOURCE)) {
      if (in != null) {
        Properties properties = new Properties();
        properties.load(in);
        String version = properties.getProperty("version", "").trim();
        if (!version.isEmpty() && !version.startsWith("${")) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read {}", VERSION_RESOURCE, ex);
    }
    String manifestVersion = Main.class.getPackage().getImplementationVersion();
    return manifestVersion != null ? manifestVersion : "unknown";
  }
}
