package ca.gc.cra.opencoffee.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> One {@code opencoffee} command line, split into the action token, the OpenCoffee flags and
 * the {@code key=value} overrides.
 * <p><strong>Role:</strong> Shared by {@link Main} (which routes on {@link #command()}) and the action CLIs (which
 * read overrides and flags).</p>
 * <p>Recognised flags are {@code --help} ({@code -h}, {@code help}), {@code --verbose} ({@code -v},
 * {@code --debug}), {@code --dry-run} and {@code --version}. Any other dash-prefixed token is reported through
 * {@link #unknownFlags()}.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  /** Flag printing the resolved plan instead of contacting Slack. */
  public static final String DRY_RUN = "--dry-run";
  /** Flag printing the tool version. */
  public static final String VERSION = "--version";

  private static final String HELP = "--help";
  private static final String VERBOSE = "--verbose";
  private static final Set<String> HELP_ALIASES = Set.of(HELP, "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of(VERBOSE, "-v", "--debug");
  private static final Set<String> KNOWN_FLAGS = Set.of(HELP, VERBOSE, DRY_RUN, VERSION);

  private final String command;
  private final List<String> keyValueArgs;
  private final List<String> argsWithoutCommand;
  private final Set<String> flags;

  private CliInput(String command, List<String> keyValueArgs, List<String> argsWithoutCommand, Set<String> flags) {
    this.command = command;
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.argsWithoutCommand = List.copyOf(argsWithoutCommand);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. The first bare token (neither a flag nor {@code key=value}) is taken as the action;
   * later bare tokens are kept with the overrides so that {@link CliArgsParser} rejects them.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    String command = null;
    List<String> kv = new ArrayList<>();
    List<String> rest = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args == null) {
      return new CliInput(null, kv, rest, flags);
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_ALIASES.contains(lower)) {
        flags.add(HELP);
      } else if (VERBOSE_ALIASES.contains(lower)) {
        flags.add(VERBOSE);
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else if (command == null && !arg.contains("=")) {
        command = lower;
        continue;
      } else {
        kv.add(arg);
      }
      rest.add(arg);
    }
    return new CliInput(command, kv, rest, flags);
  }

  /**
   * Returns the action token, lower-cased, such as {@code invitation} or {@code reminder}.
   *
   * @return action token, or empty when none was given
   */
  public Optional<String> command() {
    return Optional.ofNullable(command);
  }

  /**
   * Returns the arguments minus the action token, in command-line order, for delegation to an action CLI.
   *
   * @return copy of the arguments
   */
  public String[] argsWithoutCommand() {
    return argsWithoutCommand.toArray(String[]::new);
  }

  /**
   * Returns the {@code key=value} overrides in command-line order.
   *
   * @return copy of the overrides
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  public boolean dryRun() {
    return flags.contains(DRY_RUN);
  }

  public boolean version() {
    return flags.contains(VERSION);
  }

  /**
   * Lists dash-prefixed tokens that OpenCoffee does not know.
   *
   * @return unknown flags, lower-cased
   */
  public Set<String> unknownFlags() {
    Set<String> unknown = new LinkedHashSet<>(flags);
    unknown.removeAll(KNOWN_FLAGS);
    return unknown;
  }

  /** @return normalized flags, aliases folded into their long form */
  public Set<String> flags() {
    return flags;
  }
}
