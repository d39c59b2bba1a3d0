package ca.gc.cra.opencoffee.application.pairing;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.domain.pairing.PairingResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class PairingAssertions {
  private PairingAssertions() {}

  /** Every roster member appears exactly once across pairs and ignored members. */
  static void assertPartition(MemberRoster roster, PairingResult result) {
    List<String> all = new ArrayList<>(result.allMembers());
    Collections.sort(all);
    assertEquals(roster.members(), all);
    assertEquals(roster.size(), result.pairs().size() * 2 + result.ignored().size());
  }

  static final class CountingProgress implements ProgressListener {
    private int total;
    private int advanced;
    private int finished;

    @Override
    public void start(String step, int total) {
      this.total = total;
    }

    @Override
    public void advance(int units) {
      advanced += units;
    }

    @Override
    public void finish() {
      finished++;
    }

    int total() {
      return total;
    }

    int advanced() {
      return advanced;
    }

    int finished() {
      return finished;
    }
  }
}
