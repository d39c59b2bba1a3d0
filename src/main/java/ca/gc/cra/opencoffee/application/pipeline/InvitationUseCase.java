package ca.gc.cra.opencoffee.application.pipeline;

import ca.gc.cra.opencoffee.application.message.MessageCatalog;
import ca.gc.cra.opencoffee.application.pairing.PairingStrategy;
import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.PairHistoryPort;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.domain.pairing.PairingResult;
import ca.gc.cra.opencoffee.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one invitation round: pair the channel members, invite every pair, record the round.
 * <p><strong>Role:</strong> Application-layer use case driven by {@code InvitationCli}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the channel members, minus ignored users, into a {@link MemberRoster}.</li>
 *   <li>Delegate pair generation to the configured {@link PairingStrategy}.</li>
 *   <li>Send the invitation to each pair, pacing sends and skipping pairs whose send fails.</li>
 *   <li>Store the pairs through {@link PairHistoryPort} for the reminder round.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time.</p>
 * <p><strong>Observability:</strong> INFO summary of pairs, ignored members and sends; WARN per failed send.</p>
 *
 * @since 0.1.0
 */
public final class InvitationUseCase {
  private static final Logger log = LoggerFactory.getLogger(InvitationUseCase.class);

  private final GroupCommunicationPort service;
  private final PairingStrategy strategy;
  private final PairHistoryPort history;
  private final MessageCatalog messages;
  private final ThrottlePort throttle;
  private final String channelId;
  private final Set<String> ignoreUsers;
  private final BacktrackPolicy policy;
  private final Duration sendDelay;

  /**
   * Creates the use case.
   *
   * @param service communication port used for discovery, checks and sends
   * @param strategy pairing strategy selected by configuration
   * @param history history store receiving the committed pairs
   * @param messages catalog providing the invitation text
   * @param throttle pacing applied between sends
   * @param channelId channel whose members are paired
   * @param ignoreUsers users never paired nor contacted
   * @param policy recent-contact window and retry budget
   * @param sendDelay pause between two sends
   */
  public InvitationUseCase(
      GroupCommunicationPort service,
      PairingStrategy strategy,
      PairHistoryPort history,
      MessageCatalog messages,
      ThrottlePort throttle,
      String channelId,
      Set<String> ignoreUsers,
      BacktrackPolicy policy,
      Duration sendDelay) {
    this.service = Objects.requireNonNull(service, "service");
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    this.history = Objects.requireNonNull(history, "history");
    this.messages = Objects.requireNonNull(messages, "messages");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.channelId = Objects.requireNonNull(channelId, "channelId");
    this.ignoreUsers = Set.copyOf(Objects.requireNonNull(ignoreUsers, "ignoreUsers"));
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sendDelay = Objects.requireNonNullElse(sendDelay, Duration.ZERO);
  }

  /**
   * Executes the round.
   *
   * @return outcome of the round
   * @throws CommunicationException if member discovery or pair generation fails
   * @throws IOException if the history cannot be written
   * @throws InterruptedException if interrupted while pacing calls
   */
  public InvitationReport run() throws CommunicationException, IOException, InterruptedException {
    log.info("Reading members of channel {}", channelId);
    List<String> members = service.listChannelMembers(channelId, ignoreUsers);
    MemberRoster roster = MemberRoster.of(members);
    log.info("Channel {} has {} to pair ({} ignored by configuration)",
        channelId, Logs.plural(roster.size(), "member"), ignoreUsers.size());

    PairingResult result = strategy.computePairs(roster, service, policy);
    log.info("Generated {} with the {} algorithm", Logs.plural(result.pairs().size(), "pair"),
        strategy.algorithm().configValue());
    if (!result.ignored().isEmpty()) {
      log.info("Left out this round: {}", String.join(", ", result.ignored()));
    }

    String text = messages.invitation(channelId);
    int sent = 0;
    int failed = 0;
    for (int i = 0; i < result.pairs().size(); i++) {
      MemberPair pair = result.pairs().get(i);
      if (i > 0) {
        throttle.pause(sendDelay);
      }
      try {
        service.sendMessage(pair, text);
        sent++;
        log.debug("Invitation sent to {}", pair);
      } catch (CommunicationException ex) {
        failed++;
        log.warn("Unable to send invitation to {}: {}", pair, ex.getMessage());
      }
    }

    Path historyFile = history.save(result.pairs());
    log.info("Invitations sent: {} of {}; history stored in {}", sent, result.pairs().size(), historyFile);
    return new InvitationReport(result, sent, failed, historyFile);
  }
}
