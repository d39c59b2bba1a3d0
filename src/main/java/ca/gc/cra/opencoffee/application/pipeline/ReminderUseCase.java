package ca.gc.cra.opencoffee.application.pipeline;

import ca.gc.cra.opencoffee.application.message.MessageCatalog;
import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.PairHistoryPort;
import ca.gc.cra.opencoffee.application.port.PairHistoryPort.PairHistory;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import ca.gc.cra.opencoffee.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Nudges the pairs of the latest invitation round that have not talked yet.
 * <p><strong>Role:</strong> Application-layer use case driven by {@code ReminderCli}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the latest stored round; without one, warn and stop.</li>
 *   <li>Treat a pair as active when its conversation holds at least {@link #ACTIVE_MESSAGE_THRESHOLD} messages
 *       within the backtrack window, the invitation included.</li>
 *   <li>Send the reminder to inactive pairs, skipping pairs whose send fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time.</p>
 *
 * @since 0.1.0
 */
public final class ReminderUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReminderUseCase.class);

  /** Invitation plus four replies. */
  public static final int ACTIVE_MESSAGE_THRESHOLD = 5;

  private final GroupCommunicationPort service;
  private final PairHistoryPort history;
  private final MessageCatalog messages;
  private final ThrottlePort throttle;
  private final int backtrackDays;
  private final Duration sendDelay;

  /**
   * Creates the use case.
   *
   * @param service communication port used for checks and sends
   * @param history history store holding the latest round
   * @param messages catalog providing the reminder text
   * @param throttle pacing applied between pairs
   * @param backtrackDays window in days searched for conversation activity
   * @param sendDelay pause between two pairs
   */
  public ReminderUseCase(
      GroupCommunicationPort service,
      PairHistoryPort history,
      MessageCatalog messages,
      ThrottlePort throttle,
      int backtrackDays,
      Duration sendDelay) {
    this.service = Objects.requireNonNull(service, "service");
    this.history = Objects.requireNonNull(history, "history");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    if (backtrackDays < 0) {
      throw new IllegalArgumentException("backtrackDays must be >= 0");
    }
    this.backtrackDays = backtrackDays;
    this.sendDelay = Objects.requireNonNullElse(sendDelay, Duration.ZERO);
  }

  /**
   * Executes the round.
   *
   * @return outcome of the round
   * @throws CommunicationException if an activity check fails
   * @throws IOException if the history cannot be read
   * @throws InterruptedException if interrupted while pacing calls
   */
  public ReminderReport run() throws CommunicationException, IOException, InterruptedException {
    Optional<PairHistory> latest = history.loadLatest();
    if (latest.isEmpty()) {
      log.warn("No pair history found; run an invitation round first");
      return ReminderReport.nothingToRemind();
    }
    PairHistory round = latest.get();
    log.info("Loaded {} from {}", Logs.plural(round.pairs().size(), "pair"), round.source());

    String text = messages.reminder();
    int checked = 0;
    int reminded = 0;
    int failed = 0;
    for (MemberPair pair : round.pairs()) {
      if (checked > 0) {
        throttle.pause(sendDelay);
      }
      checked++;
      if (service.hasRecentExchange(pair, backtrackDays, ACTIVE_MESSAGE_THRESHOLD)) {
        log.debug("{} already talked; no reminder needed", pair);
        continue;
      }
      try {
        service.sendMessage(pair, text);
        reminded++;
        log.debug("Reminder sent to {}", pair);
      } catch (CommunicationException ex) {
        failed++;
        log.warn("Unable to send reminder to {}: {}", pair, ex.getMessage());
      }
    }
    log.info("Reminders sent: {} ({} checked, {} failed)", reminded, Logs.plural(checked, "pair"), failed);
    return new ReminderReport(Optional.of(round.source()), checked, reminded, failed);
  }
}
