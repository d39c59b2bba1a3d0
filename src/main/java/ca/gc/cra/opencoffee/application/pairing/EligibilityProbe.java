package ca.gc.cra.opencoffee.application.pairing;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recent-exchange check shared by the pairing strategies, pacing every retry check.
 */
final class EligibilityProbe {
  private static final Logger log = LoggerFactory.getLogger(EligibilityProbe.class);

  private final GroupCommunicationPort service;
  private final BacktrackPolicy policy;
  private final ThrottlePort throttle;
  private int checks;

  EligibilityProbe(GroupCommunicationPort service, BacktrackPolicy policy, ThrottlePort throttle) {
    this.service = Objects.requireNonNull(service, "service");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
  }

  /**
   * Checks whether {@code candidate} may be paired with {@code current}.
   *
   * @param current member looking for a partner
   * @param candidate proposed partner
   * @param attempt zero for the first check of {@code current}, then one per retry
   * @return {@code true} when no recent exchange exists
   */
  boolean isEligible(String current, String candidate, int attempt)
      throws CommunicationException, InterruptedException {
    if (attempt > 0) {
      throttle.pause(policy.retryDelay());
    }
    MemberPair pair = new MemberPair(current, candidate);
    checks++;
    boolean recent = service.hasRecentExchange(pair, policy.backtrackDays());
    if (recent) {
      log.debug("Found recent chat for {}, trying a different partner", pair);
    }
    return !recent;
  }

  /** Whether another check is allowed after {@code attempt} failed checks. */
  boolean withinBudget(int attempt) {
    return attempt <= policy.maxAttempts();
  }

  int checks() {
    return checks;
  }
}
