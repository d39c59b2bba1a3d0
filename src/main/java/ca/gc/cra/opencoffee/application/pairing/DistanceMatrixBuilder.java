package ca.gc.cra.opencoffee.application.pairing;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.application.port.ProgressListener;
import ca.gc.cra.opencoffee.application.port.ThrottlePort;
import ca.gc.cra.opencoffee.domain.pairing.DistanceMatrix;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the {@link DistanceMatrix} of a roster from public channel memberships.
 * <p><strong>Role:</strong> Collaborator of {@link MaxDistancePairingStrategy}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List every public channel, then the members of each channel.</li>
 *   <li>Increment the cell of every roster pair found together in a channel.</li>
 *   <li>Pause between successive remote calls.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; each build owns its matrix.</p>
 * <p><strong>Performance:</strong> {@code 1 + channels} remote calls; O(channels x roster^2) increments worst case.</p>
 *
 * @since 0.1.0
 */
public final class DistanceMatrixBuilder {
  private static final Logger log = LoggerFactory.getLogger(DistanceMatrixBuilder.class);

  private final ThrottlePort throttle;
  private final Duration callDelay;
  private final ProgressListener progress;

  /**
   * Creates a builder.
   *
   * @param throttle pacing between remote calls; must not be {@code null}
   * @param callDelay pause between successive remote calls; {@code null} means no pause
   * @param progress progress listener for the channel scan; must not be {@code null}
   */
  public DistanceMatrixBuilder(ThrottlePort throttle, Duration callDelay, ProgressListener progress) {
    this.throttle = Objects.requireNonNull(throttle, "throttle");
    this.callDelay = Objects.requireNonNullElse(callDelay, Duration.ZERO);
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  /**
   * Scans public channels and counts co-occurrences for every roster pair.
   *
   * @param roster sorted roster fixing matrix indices; must not be {@code null}
   * @param service communication port; must not be {@code null}
   * @return fully built matrix
   * @throws CommunicationException if listing channels or members fails; no partial matrix is returned
   * @throws InterruptedException if interrupted while pacing calls
   */
  public DistanceMatrix build(MemberRoster roster, GroupCommunicationPort service)
      throws CommunicationException, InterruptedException {
    Objects.requireNonNull(roster, "roster");
    Objects.requireNonNull(service, "service");

    DistanceMatrix matrix = new DistanceMatrix(roster);
    if (roster.size() < 2) {
      // Fewer than two members: no channel scan.
      return matrix;
    }

    List<String> channels = service.listPublicChannels();
    log.info("Computing member distances across {} public channels", channels.size());

    progress.start("Scan channels", channels.size());
    try {
      for (String channel : channels) {
        throttle.pause(callDelay);
        List<String> members = service.listChannelMembers(channel, Set.of());
        int[] indices = rosterIndices(roster, members);
        for (int a = 0; a < indices.length; a++) {
          for (int b = a + 1; b < indices.length; b++) {
            matrix.increment(indices[a], indices[b]);
          }
        }
        log.trace("Channel {} contributes {} roster members", channel, indices.length);
        progress.advance(1);
      }
    } finally {
      progress.finish();
    }
    return matrix;
  }

  /**
   * Maps channel members to ascending roster positions, dropping members not on the roster.
   */
  static int[] rosterIndices(MemberRoster roster, List<String> channelMembers) {
    TreeSet<String> sorted = new TreeSet<>();
    for (String member : channelMembers) {
      if (member != null) {
        sorted.add(member);
      }
    }
    int[] indices = new int[sorted.size()];
    int count = 0;
    for (String member : sorted) {
      int index = roster.indexOf(member);
      if (index >= 0) {
        indices[count++] = index;
      }
    }
    return Arrays.copyOf(indices, count);
  }
}
