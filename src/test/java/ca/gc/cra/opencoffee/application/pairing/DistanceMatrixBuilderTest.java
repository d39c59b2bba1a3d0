package ca.gc.cra.opencoffee.application.pairing;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.domain.pairing.DistanceMatrix;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.testutil.FakeCommunicationPort;
import ca.gc.cra.opencoffee.testutil.RecordingThrottle;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DistanceMatrixBuilderTest {
  private final RecordingThrottle throttle = new RecordingThrottle();
  private final DistanceMatrixBuilder builder =
      new DistanceMatrixBuilder(throttle, Duration.ofMillis(500), ProgressListener.NO_OP);

  @Test
  void countsSharedChannels() throws Exception {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U2", "U1")
        .channel("C2", "U1", "U2", "OUTSIDER");

    DistanceMatrix matrix = builder.build(MemberRoster.of("U1", "U2", "U3"), port);

    assertEquals(2, matrix.distance("U1", "U2"));
    assertEquals(0, matrix.distance("U1", "U3"));
    assertEquals(0, matrix.distance("U2", "U3"));
    assertEquals(matrix.distance("U2", "U1"), matrix.distance("U1", "U2"));
  }

  @Test
  void makesOneListingCallPerChannelAndPausesBetweenCalls() throws Exception {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1")
        .channel("C2", "U2")
        .channel("C3");

    builder.build(MemberRoster.of("U1", "U2"), port);

    assertEquals(1, port.listChannelsCalls());
    assertEquals(3, port.listMembersCalls());
    assertEquals(3, throttle.pauses().size());
    assertTrue(port.exclusions().stream().allMatch(Set::isEmpty));
  }

  @Test
  void skipsTheScanWhenNothingCanBePaired() throws Exception {
    FakeCommunicationPort port = new FakeCommunicationPort().channel("C1", "U1");

    DistanceMatrix matrix = builder.build(MemberRoster.of("U1"), port);

    assertEquals(1, matrix.size());
    assertEquals(0, port.listChannelsCalls());
  }

  @Test
  void channelListingFailureAborts() {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U2")
        .failListing(new CommunicationException("not_authed"));

    assertThrows(CommunicationException.class, () -> builder.build(MemberRoster.of("U1", "U2"), port));
  }

  @Test
  void memberListingFailureAbortsAfterChannelsWereListed() {
    FakeCommunicationPort port = new FakeCommunicationPort()
        .channel("C1", "U1", "U2")
        .channel("C2", "U2", "U3")
        .failMemberListing(new CommunicationException("members unavailable"));

    CommunicationException ex = assertThrows(CommunicationException.class,
        () -> builder.build(MemberRoster.of("U1", "U2", "U3"), port));

    assertEquals("members unavailable", ex.getMessage());
    assertEquals(1, port.listChannelsCalls());
    assertEquals(1, port.listMembersCalls());
  }

  @Test
  void rosterIndicesAreSortedAndFiltered() {
    MemberRoster roster = MemberRoster.of("A", "B", "C", "D");

    assertArrayEquals(new int[] {0, 2, 3}, DistanceMatrixBuilder.rosterIndices(roster, List.of("D", "X", "A", "C", "A")));
  }
}
