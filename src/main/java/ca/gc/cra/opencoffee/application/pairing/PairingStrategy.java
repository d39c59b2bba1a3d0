package ca.gc.cra.opencoffee.application.pairing;

import ca.gc.cra.opencoffee.application.port.CommunicationException;
import ca.gc.cra.opencoffee.application.port.GroupCommunicationPort;
import ca.gc.cra.opencoffee.domain.pairing.BacktrackPolicy;
import ca.gc.cra.opencoffee.domain.pairing.MemberRoster;
import ca.gc.cra.opencoffee.domain.pairing.PairingResult;

/**
 * <strong>What:</strong> Algorithm turning a roster into disjoint coffee pairs plus a set of ignored members.
 * <p><strong>Role:</strong> Application service selected through {@link PairingAlgorithm}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Place every roster member in exactly one pair or exactly once in the ignored list.</li>
 *   <li>Skip partners with a recent exchange inside the {@link BacktrackPolicy} window, retrying up to its budget.</li>
 *   <li>Abort on the first communication failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations keep no per-run state between calls but are not meant for
 * concurrent runs sharing the same random source.</p>
 *
 * @since 0.1.0
 */
public interface PairingStrategy {

  /**
   * Computes the pairs for one run.
   *
   * @param roster sorted, deduplicated members; never mutated
   * @param service communication port used for eligibility checks (and channel scans where relevant)
   * @param policy recent-exchange window, retry budget and retry pacing
   * @return pairs and ignored members covering the roster exactly once
   * @throws CommunicationException if any remote call fails; no partial result is returned
   * @throws InterruptedException if the thread is interrupted while pacing remote calls
   */
  PairingResult computePairs(MemberRoster roster, GroupCommunicationPort service, BacktrackPolicy policy)
      throws CommunicationException, InterruptedException;

  /**
   * Returns the algorithm implemented by this strategy.
   *
   * @return algorithm identifier
   */
  PairingAlgorithm algorithm();
}
