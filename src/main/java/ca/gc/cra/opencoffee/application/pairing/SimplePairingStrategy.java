package ca.gc.cra.opencoffee.application.pairing;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.domain.pairing.PairingResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Random greedy pairing that avoids members who chatted recently.
 * <p><strong>Role:</strong> Default {@link PairingStrategy} ({@link PairingAlgorithm#SIMPLE}).</p>
 * <p><strong>Algorithm:</strong> shuffle the working set, take the first member, draw random partners from the
 * rest without replacement until one has no recent exchange or the retry budget runs out.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time per instance.</p>
 * <p><strong>Performance:</strong> At most {@code maxAttempts + 1} remote checks per member.</p>
 *
 * @since 0.1.0
 */
public final class SimplePairingStrategy implements PairingStrategy {
  private static final Logger log = LoggerFactory.getLogger(SimplePairingStrategy.class);

  private final Random random;
  private final ThrottlePort throttle;
  private final ProgressListener progress;

  /**
   * Creates a strategy with explicit randomness, pacing and progress reporting.
   *
   * @param random random source for shuffling and candidate draws; must not be {@code null}
   * @param throttle pacing applied before retry checks; must not be {@code null}
   * @param progress progress listener; must not be {@code null}
   */
  public SimplePairingStrategy(Random random, ThrottlePort throttle, ProgressListener progress) {
    this.random = Objects.requireNonNull(random, "random");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  @Override
  public PairingAlgorithm algorithm() {
    return PairingAlgorithm.SIMPLE;
  }

  @Override
  public PairingResult computePairs(MemberRoster roster, GroupCommunicationPort service, BacktrackPolicy policy)
      throws CommunicationException, InterruptedException {
    Objects.requireNonNull(roster, "roster");
    Objects.requireNonNull(service, "service");
    Objects.requireNonNull(policy, "policy");

    List<String> working = roster.workingCopy();
    Collections.shuffle(working, random);

    EligibilityProbe probe = new EligibilityProbe(service, policy, throttle);
    List<MemberPair> pairs = new ArrayList<>();
    List<String> ignored = new ArrayList<>();

    progress.start("Generate pairs", working.size());
    try {
      while (working.size() > 1) {
        String current = working.remove(0);
        Optional<String> partner = findPartner(current, working, probe);
        if (partner.isPresent()) {
          working.remove(partner.get());
          pairs.add(new MemberPair(current, partner.get()));
          progress.advance(2);
        } else {
          log.debug("No valid partner found for {}", current);
          ignored.add(current);
          progress.advance(1);
        }
      }
      progress.advance(working.size());
      ignored.addAll(working);
    } finally {
      progress.finish();
    }

    log.debug("Simple pairing finished: {} pairs, {} ignored, {} eligibility checks",
        pairs.size(), ignored.size(), probe.checks());
    return new PairingResult(pairs, ignored);
  }

  private Optional<String> findPartner(String current, List<String> remaining, EligibilityProbe probe)
      throws CommunicationException, InterruptedException {
    List<String> pool = new ArrayList<>(remaining);
    int attempt = 0;
    while (!pool.isEmpty() && probe.withinBudget(attempt)) {
      String candidate = pool.remove(random.nextInt(pool.size()));
      if (probe.isEligible(current, candidate, attempt)) {
        return Optional.of(candidate);
      }
      attempt++;
    }
    return Optional.empty();
  }
}
