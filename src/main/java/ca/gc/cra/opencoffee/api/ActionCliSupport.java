package ca.gc.cra.opencoffee.api;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.config.CompositionRoot;
import ca.gc.cra.opencoffee.config.ConfigMerger;
import ca.gc.cra.opencoffee.config.DefaultsForMode;
import ca.gc.cra.opencoffee.config.OpenCoffeeConfig;
import ca.gc.cra.opencoffee.config.YamlConfigLoader;
import ca.gc.cra.opencoffee.logging.LoggingConfigurator;
import ca.gc.cra.opencoffee.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared flow of the action CLIs: arguments, configuration, logging, dry-run plan, execution and exit code mapping.
 */
final class ActionCliSupport {
  private static final Logger log = LoggerFactory.getLogger(ActionCliSupport.class);

  /** Work performed by an action once configuration is resolved. */
  interface Action {
    void run(CompositionRoot root) throws CommunicationException, IOException, InterruptedException;
  }

  private ActionCliSupport() {
    // Utility class
  }

  static ExitCode execute(String action, String[] args, String helpText, String usage, Action body) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.version()) {
      Main.printVersion();
      return ExitCode.SUCCESS;
    }
    if (input.command().isPresent() || !input.unknownFlags().isEmpty()) {
      log.error("Invalid argument: {}", input.command().orElseGet(() -> String.join(" ", input.unknownFlags())));
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} CLI", action);
    }

    Map<String, String> kv;
    Path configPath;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      configPath = ConfigCliUtils.extractConfigPath(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    if (!Files.isRegularFile(configPath)) {
      log.error("Configuration file does not exist: {}", configPath);
      CliPrinter.println(usage);
      return ExitCode.CONFIG_ERROR;
    }

    Optional<Map<String, String>> yamlConfig;
    try {
      yamlConfig = YamlConfigLoader.load(configPath, action);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    OpenCoffeeConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          action, yamlConfig, kv, DefaultsForMode.asFlatMap(action), log::warn);
      config = OpenCoffeeConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", action, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    LoggingConfigurator.configure(config.log().level(), input.verbose(), config.log().toFile(), config.log().path());

    boolean dryRun = input.dryRun() || ConfigCliUtils.parseBoolean(kv, "dryRun", false);
    if (dryRun) {
      printDryRunPlan(action, configPath, config);
      return ExitCode.SUCCESS;
    }

    String configName = configPath.getFileName().toString();
    log.info("Starting {} with configuration {}{}", action, configName, config.testMode() ? " (test mode)" : "");
    try {
      body.run(new CompositionRoot(config, configName));
      log.info("{} completed", action);
      return ExitCode.SUCCESS;
    } catch (CommunicationException ex) {
      log.error("{} aborted: {}", action, ex.getMessage(), ex);
      return ExitCode.COMMUNICATION_ERROR;
    } catch (IOException ex) {
      log.error("{} I/O failure", action, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", action, ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", action, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", action, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static void printDryRunPlan(String action, Path configPath, OpenCoffeeConfig config) {
    OpenCoffeeConfig.SlackSettings slack = config.slack();
    Map<String, String> plan = new LinkedHashMap<>();
    plan.put("Config file", configPath.toString());
    plan.put("Language", config.language().getLanguage());
    plan.put("Test mode", Boolean.toString(config.testMode()));
    plan.put("History path", config.historyPath().toString());
    plan.put("Algorithm", config.algorithm().configValue());
    plan.put("Channel", slack.channelId());
    plan.put("Ignored users", Integer.toString(slack.ignoreUsers().size()));
    plan.put("Backtrack days", Integer.toString(slack.backtrackDays()));
    plan.put("Max attempts", Integer.toString(slack.backtrackMaxAttempts()));
    plan.put("Slack API", slack.apiBaseUrl().toString());
    plan.put("Slack token", Logs.redact(slack.apiToken()));
    plan.put("Call delay (ms)", Long.toString(slack.callDelay().toMillis()));
    plan.put("Send delay (ms)", Long.toString(slack.sendDelay().toMillis()));
    plan.put("Log level", config.log().level());
    plan.put("Log file", config.log().toFile()
        ? config.log().path().resolve(LoggingConfigurator.LOG_FILE_NAME).toString() : "<console only>");
    CliPrinter.printPlan("OpenCoffee " + action + " dry-run: nothing will be sent.", plan,
        "Re-run without " + CliInput.DRY_RUN + " to contact Slack.");
  }
}
