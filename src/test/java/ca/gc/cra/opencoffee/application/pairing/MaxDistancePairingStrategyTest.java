package ca.gc.cra.opencoffee.application.pairing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.domain.pairing.DistanceMatrix;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.domain.pairing.PairingResult;
import ca.gc.cra.opencoffee.testutil.FakeCommunicationPort;
import ca.gc.cra.opencoffee.testutil.LastIndexRandom;
import java.time.Duration;
import java.util.List;
import java.util.NavigableMap;
import org.junit.jupiter.api.Test;

class MaxDistancePairingStrategyTest {
  private static final BacktrackPolicy POLICY = BacktrackPolicy.withoutDelay(180, 3);

  @Test
  void prefersTheMemberSharingNoChannel() throws Exception {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U2")
        .channel("C2", "U1", "U2");

    PairingResult result = strategy().computePairs(MemberRoster.of("U1", "U2", "U3"), port, POLICY);

    assertEquals(List.of(new MemberPair("U1", "U3")), result.pairs());
    assertEquals(List.of("U2"), result.ignored());
  }

  @Test
  void distanceWinsOverDrawOrder() throws Exception {
    // The draw favours the last member; the matrix must still win.
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U3")
        .channel("C2", "U1", "U3");

    PairingResult result = strategy().computePairs(MemberRoster.of("U1", "U2", "U3"), port, POLICY);

    assertEquals(List.of(new MemberPair("U1", "U2")), result.pairs());
  }

  @Test
  void fallsBackToTheNextBucketWhenTheClosestIsRecent() throws Exception {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U2")
        .channel("C2", "U1", "U2")
        .recent("U1", "U3");

    PairingResult result = strategy().computePairs(MemberRoster.of("U1", "U2", "U3"), port, POLICY);

    assertEquals(List.of(new MemberPair("U1", "U2")), result.pairs());
    assertEquals(List.of("U3"), result.ignored());
    assertEquals(List.of(new MemberPair("U1", "U3"), new MemberPair("U1", "U2")), port.checks());
  }

  @Test
  void retryBudgetIsSharedAcrossBuckets() throws Exception {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("A", "U1", "U3")
        .channel("B", "U1", "U4")
        .channel("C", "U1", "U4")
        .recent("U1", "U2")
        .recent("U1", "U3");

    PairingResult result = strategy().computePairs(
        MemberRoster.of("U1", "U2", "U3", "U4"), port, BacktrackPolicy.withoutDelay(180, 1));

    assertEquals(List.of(new MemberPair("U2", "U4")), result.pairs());
    assertEquals(List.of("U1", "U3"), result.ignored());
    assertEquals(2, port.checks().stream().filter(pair -> pair.contains("U1")).count());
  }

  @Test
  void groupsRemainingMembersByAscendingDistance() {
    DistanceMatrix matrix = new DistanceMatrix(MemberRoster.of("U1", "U2", "U3", "U4"));
    matrix.increment(0, 1);
    matrix.increment(0, 1);
    matrix.increment(0, 3);

    NavigableMap<Integer, List<String>> buckets =
        MaxDistancePairingStrategy.groupByDistance("U1", List.of("U4", "U3", "U2"), matrix);

    assertEquals(List.of(0, 1, 2), List.copyOf(buckets.keySet()));
    assertEquals(List.of("U3"), buckets.get(0));
    assertEquals(List.of("U4"), buckets.get(1));
    assertEquals(List.of("U2"), buckets.get(2));
  }

  @Test
  void matrixFailureAbortsBeforeAnyCheck() {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U2")
        .failListing(new CommunicationException("channel scan failed"));

    assertThrows(CommunicationException.class,
        () -> strategy().computePairs(MemberRoster.of("U1", "U2"), port, POLICY));
    assertTrue(port.checks().isEmpty());
  }

  @Test
  void memberListingFailureStopsBeforeAnyCheck() {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U2")
        .failMemberListing(new CommunicationException("members unavailable"));

    assertThrows(CommunicationException.class,
        () -> strategy().computePairs(MemberRoster.of("U1", "U2"), port, POLICY));
    assertEquals(1, port.listChannelsCalls());
    assertTrue(port.checks().isEmpty());
  }

  @Test
  void noPairIsCommittedWhenEveryoneTalkedRecently() throws Exception {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U2", "U3")
        .channel("C2", "U4", "U5", "U6")
        .everyoneRecent();
    MemberRoster roster = MemberRoster.of("U1", "U2", "U3", "U4", "U5", "U6");

    PairingResult result = strategy().computePairs(roster, port, POLICY);

    assertTrue(result.pairs().isEmpty());
    assertEquals(6, result.ignored().size());
    PairingAssertions.assertPartition(roster, result);
    // Four checks for each of the first two members; later members run out of candidates first.
    assertEquals(14, port.checks().size());
  }

  @Test
  void reportsItsAlgorithm() {
    assertEquals(PairingAlgorithm.MAX_DISTANCE, strategy().algorithm());
  }

  private MaxDistancePairingStrategy strategy() {
    return new MaxDistancePairingStrategy(new LastIndexRandom(), ThrottlePort.NONE, ProgressListener.NO_OP,
        new DistanceMatrixBuilder(ThrottlePort.NONE, Duration.ZERO, ProgressListener.NO_OP));
  }
}
