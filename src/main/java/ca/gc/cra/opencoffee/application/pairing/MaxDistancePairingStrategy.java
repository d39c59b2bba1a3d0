package ca.gc.cra.opencoffee.application.pairing;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.domain.pairing.DistanceMatrix;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.domain.pairing.PairingResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Greedy pairing that prefers partners sharing the fewest public channels.
 * <p><strong>Role:</strong> {@link PairingStrategy} for {@link PairingAlgorithm#MAX_DISTANCE}.</p>
 * <p><strong>Algorithm:</strong>
 * <ol>
 *   <li>Build the {@link DistanceMatrix} of the sorted roster.</li>
 *   <li>Shuffle a working copy; the shuffle only breaks ties between equal distances.</li>
 *   <li>For the first member, bucket the remaining members by distance and walk buckets in ascending order,
 *       drawing random members from a bucket until it is exhausted.</li>
 *   <li>The retry budget is shared across all buckets for that member.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time per instance.</p>
 * <p><strong>Performance:</strong> One full channel scan per run plus at most {@code maxAttempts + 1} checks per member.</p>
 *
 * @since 0.1.0
 */
public final class MaxDistancePairingStrategy implements PairingStrategy {
  private static final Logger log = LoggerFactory.getLogger(MaxDistancePairingStrategy.class);

  private final Random random;
  private final ThrottlePort throttle;
  private final ProgressListener progress;
  private final DistanceMatrixBuilder matrixBuilder;

  /**
   * Creates a strategy.
   *
   * @param random random source for shuffling and draws inside a bucket; must not be {@code null}
   * @param throttle pacing applied before retry checks; must not be {@code null}
   * @param progress progress listener; must not be {@code null}
   * @param matrixBuilder builder for the distance matrix; must not be {@code null}
   */
  public MaxDistancePairingStrategy(
      Random random, ThrottlePort throttle, ProgressListener progress, DistanceMatrixBuilder matrixBuilder) {
    this.random = Objects.requireNonNull(random, "random");
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.progress = Objects.requireNonNull(progress, "progress");
    this.matrixBuilder = Objects.requireNonNull(matrixBuilder, "matrixBuilder");
  }

  @Override
  public PairingAlgorithm algorithm() {
    return PairingAlgorithm.MAX_DISTANCE;
  }

  @Override
  public PairingResult computePairs(MemberRoster roster, GroupCommunicationPort service, BacktrackPolicy policy)
      throws CommunicationException, InterruptedException {
    Objects.requireNonNull(roster, "roster");
    Objects.requireNonNull(service, "service");
    Objects.requireNonNull(policy, "policy");

    DistanceMatrix matrix = matrixBuilder.build(roster, service);

    List<String> working = roster.workingCopy();
    Collections.shuffle(working, random);

    EligibilityProbe probe = new EligibilityProbe(service, policy, throttle);
    List<MemberPair> pairs = new ArrayList<>();
    List<String> ignored = new ArrayList<>();

    progress.start("Generate pairs", working.size());
    try {
      while (working.size() > 1) {
        String current = working.remove(0);
        NavigableMap<Integer, List<String>> buckets = groupByDistance(current, working, matrix);
        Optional<String> partner = findPartner(current, buckets, probe);
        if (partner.isPresent()) {
          working.remove(partner.get());
          pairs.add(new MemberPair(current, partner.get()));
          log.debug("Paired {} with {} (distance {})",
              current, partner.get(), matrix.distance(current, partner.get()));
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

    log.debug("Max-distance pairing finished: {} pairs, {} ignored, {} eligibility checks",
        pairs.size(), ignored.size(), probe.checks());
    return new PairingResult(pairs, ignored);
  }

  /**
   * Buckets the remaining members by distance to {@code current}, ascending, keeping working-set order per bucket.
   */
  static NavigableMap<Integer, List<String>> groupByDistance(
      String current, List<String> remaining, DistanceMatrix matrix) {
    MemberRoster roster = matrix.roster();
    int currentIndex = roster.indexOf(current);
    NavigableMap<Integer, List<String>> buckets = new TreeMap<>();
    for (String other : remaining) {
      int distance = matrix.distance(currentIndex, roster.indexOf(other));
      buckets.computeIfAbsent(distance, key -> new ArrayList<>()).add(other);
    }
    return buckets;
  }

  private Optional<String> findPartner(
      String current, NavigableMap<Integer, List<String>> buckets, EligibilityProbe probe)
      throws CommunicationException, InterruptedException {
    int attempt = 0;
    for (List<String> bucket : buckets.values()) {
      List<String> pool = new ArrayList<>(bucket);
      while (!pool.isEmpty()) {
        if (!probe.withinBudget(attempt)) {
          return Optional.empty();
        }
        String candidate = pool.remove(random.nextInt(pool.size()));
        if (probe.isEligible(current, candidate, attempt)) {
          return Optional.of(candidate);
        }
        attempt++;
      }
    }
    return Optional.empty();
  }
}
