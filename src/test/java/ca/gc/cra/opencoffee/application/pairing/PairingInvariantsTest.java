package ca.gc.cra.opencoffee.application.pairing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.domain.pairing.PairingResult;
import ca.gc.cra.opencoffee.testutil.FakeCommunicationPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PairingInvariantsTest {
  private static final int MAX_SIZE = 17;
  private static final int SEEDS = 12;

  @ParameterizedTest
  @EnumSource(PairingAlgorithm.class)
  void everyMemberIsPlacedOnceAndOddRostersLeaveOneOut(PairingAlgorithm algorithm) throws Exception {
    for (int size = 0; size <= MAX_SIZE; size++) {
      for (int seed = 0; seed < SEEDS; seed++) {
        MemberRoster roster = roster(size);
        FakeCommunicationPort port = withChannels(new FakeCommunicationPort(), roster, new Random(seed));

        PairingResult result = create(algorithm, seed)
            .computePairs(roster, port, BacktrackPolicy.withoutDelay(180, 3));

        PairingAssertions.assertPartition(roster, result);
        assertEquals(size % 2, result.ignored().size(), "size " + size + " seed " + seed);
      }
    }
  }

  @ParameterizedTest
  @EnumSource(PairingAlgorithm.class)
  void recentPairsAreNeverCommitted(PairingAlgorithm algorithm) throws Exception {
    for (int size = 2; size <= MAX_SIZE; size++) {
      for (int seed = 0; seed < SEEDS; seed++) {
        Random random = new Random(31L * size + seed);
        MemberRoster roster = roster(size);
        FakeCommunicationPort port = withChannels(new FakeCommunicationPort(), roster, random);
        Set<MemberPair> recent = new HashSet<>();
        for (int i = 0; i < size; i++) {
          for (int j = i + 1; j < size; j++) {
            if (random.nextInt(3) == 0) {
              port.recent(roster.get(i), roster.get(j));
              recent.add(new MemberPair(roster.get(i), roster.get(j)));
            }
          }
        }

        PairingResult result = create(algorithm, seed)
            .computePairs(roster, port, BacktrackPolicy.withoutDelay(180, 3));

        PairingAssertions.assertPartition(roster, result);
        for (MemberPair pair : result.pairs()) {
          assertFalse(recent.contains(pair.canonical()), "committed recent pair " + pair);
        }
      }
    }
  }

  @ParameterizedTest
  @EnumSource(PairingAlgorithm.class)
  void sameSeedGivesSameResult(PairingAlgorithm algorithm) throws Exception {
    MemberRoster roster = roster(11);
    FakeCommunicationPort port = withChannels(new FakeCommunicationPort(), roster, new Random(7));

    PairingResult first = create(algorithm, 42).computePairs(roster, port, BacktrackPolicy.withoutDelay(180, 3));
    PairingResult second = create(algorithm, 42).computePairs(roster, port, BacktrackPolicy.withoutDelay(180, 3));

    assertEquals(first, second);
  }

  private static PairingStrategy create(PairingAlgorithm algorithm, long seed) {
    return PairingStrategies.create(algorithm, new Random(seed), ThrottlePort.NONE, Duration.ZERO,
        ProgressListener.NO_OP);
  }

  private static MemberRoster roster(int size) {
    List<String> members = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      members.add(String.format("U%03d", i));
    }
    return MemberRoster.of(members);
  }

  private static FakeCommunicationPort withChannels(FakeCommunicationPort port, MemberRoster roster, Random random) {
    for (int c = 0; c < 4; c++) {
      List<String> members = new ArrayList<>();
      for (String member : roster.members()) {
        if (random.nextBoolean()) {
          members.add(member);
        }
      }
      port.channel("C" + c, members.toArray(String[]::new));
    }
    return port;
  }
}
