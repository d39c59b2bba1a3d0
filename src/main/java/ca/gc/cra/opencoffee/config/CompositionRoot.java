package ca.gc.cra.opencoffee.config;

import ca.gc.cra.opencoffee.application.message.MessageCatalog;
import ca.gc.cra.opencoffee.application.pairing.PairingStrategies;
import ca.gc.cra.opencoffee.application.pairing.PairingStrategy;
import ca.gc.cra.opencoffee.application.pipeline.InvitationUseCase;
import ca.gc.cra.opencoffee.application.pipeline.ReminderUseCase;
import ca.gc.cra.opencoffee.application.port.ClockPort;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.PairHistoryPort;
import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.infrastructure.history.JsonPairHistoryAdapter;
import ca.gc.cra.opencoffee.infrastructure.progress.LoggingProgressListener;
import ca.gc.cra.opencoffee.infrastructure.slack.SlackCommunicationAdapter;
import ca.gc.cra.opencoffee.infrastructure.time.SleepingThrottleAdapter;
import ca.gc.cra.opencoffee.infrastructure.time.SystemClockAdapter;
import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Random;

/**
 * <strong>What:</strong> Central composition root that wires OpenCoffee use cases to concrete adapters.
 * <p><strong>Role:</strong> Adapter composition root; the only place that knows Slack, files and the system clock.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the Slack adapter, the history store and the message catalog from {@link OpenCoffeeConfig}.</li>
 *   <li>Select the pairing strategy for the configured algorithm.</li>
 *   <li>Assemble the invitation and reminder use cases.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods are not synchronized.</p>
 *
 * @since 0.1.0
 * @see InvitationUseCase
 * @see ReminderUseCase
 */
public final class CompositionRoot {
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final OpenCoffeeConfig config;
  private final String configName;
  private final ClockPort clock;
  private final ThrottlePort throttle;
  private final Random random;
  private final HttpClient httpClient;

  /**
   * Creates a composition root backed by the system clock, real sleeps and a secure random source.
   *
   * @param config validated configuration
   * @param configName file name of the configuration, used to name history files
   */
  public CompositionRoot(OpenCoffeeConfig config, String configName) {
    this(config, configName, new SystemClockAdapter(), new SleepingThrottleAdapter(), new SecureRandom(),
        HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
  }

  CompositionRoot(
      OpenCoffeeConfig config,
      String configName,
      ClockPort clock,
      ThrottlePort throttle,
      Random random,
      HttpClient httpClient) {
    this.config = Objects.requireNonNull(config, "config");
    this.configName = Objects.requireNonNull(configName, "configName");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.random = Objects.requireNonNull(random, "random");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  /**
   * Builds the invitation use case.
   *
   * @return invitation use case
   */
  public InvitationUseCase invitationUseCase() {
    OpenCoffeeConfig.SlackSettings slack = config.slack();
    return new InvitationUseCase(
        communicationPort(),
        pairingStrategy(),
        historyPort(),
        messageCatalog(),
        throttle,
        slack.channelId(),
        slack.ignoreUsers(),
        config.backtrackPolicy(),
        slack.sendDelay());
  }

  /**
   * Builds the reminder use case.
   *
   * @return reminder use case
   */
  public ReminderUseCase reminderUseCase() {
    OpenCoffeeConfig.SlackSettings slack = config.slack();
    return new ReminderUseCase(
        communicationPort(),
        historyPort(),
        messageCatalog(),
        throttle,
        slack.backtrackDays(),
        slack.sendDelay());
  }

  GroupCommunicationPort communicationPort() {
    OpenCoffeeConfig.SlackSettings slack = config.slack();
    return new SlackCommunicationAdapter(
        httpClient, slack.apiBaseUrl(), slack.apiToken(), config.testMode(), throttle, slack.callDelay(), clock);
  }

  PairHistoryPort historyPort() {
    return new JsonPairHistoryAdapter(config.historyPath(), configName, config.testMode(), clock, ZoneId.systemDefault());
  }

  PairingStrategy pairingStrategy() {
    ProgressListener progress = new LoggingProgressListener();
    return PairingStrategies.create(config.algorithm(), random, throttle, config.slack().callDelay(), progress);
  }

  MessageCatalog messageCatalog() {
    return new MessageCatalog(config.language());
  }
}
