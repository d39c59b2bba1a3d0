package ca.gc.cra.opencoffee.application.port;

import ca.gc.cra.opencoffee.domain.pairing.MemberPair;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port persisting the pairs of an invitation round for the following reminder round.
 * <p><strong>Role:</strong> Implemented by {@code JsonPairHistoryAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded use per run.</p>
 *
 * @since 0.1.0
 */
public interface PairHistoryPort {

  /**
   * Stores the pairs of the current round.
   *
   * @param pairs pairs in commit order
   * @return location of the stored history
   * @throws IOException when the history cannot be written
   */
  Path save(List<MemberPair> pairs) throws IOException;

  /**
   * Loads the most recent round stored for this configuration.
   *
   * @return latest history, or empty when none exists
   * @throws IOException when the history directory or file cannot be read
   */
  Optional<PairHistory> loadLatest() throws IOException;

  /**
   * Pairs read back from a stored round.
   *
   * @param source file the pairs were read from
   * @param pairs pairs in stored order
   */
  record PairHistory(Path source, List<MemberPair> pairs) {
    public PairHistory {
      Objects.requireNonNull(source, "source");
      pairs = List.copyOf(Objects.requireNonNull(pairs, "pairs"));
    }
  }
}
