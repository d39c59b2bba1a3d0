package ca.gc.cra.opencoffee.application.pipeline;

import ca.gc.cra.opencoffee.domain.pairing.PairingResult;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of an invitation round.
 *
 * @param result pairs and ignored members
 * @param sent number of pairs that received the invitation
 * @param failed number of pairs whose send failed
 * @param historyFile file the pairs were stored in
 * @since 0.1.0
 */
public record InvitationReport(PairingResult result, int sent, int failed, Path historyFile) {
  public InvitationReport {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(historyFile, "historyFile");
  }
}
