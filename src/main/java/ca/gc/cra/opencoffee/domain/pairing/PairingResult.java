package ca.gc.cra.opencoffee.domain.pairing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output of one pairing run: the committed pairs in commit order and the members left out.
 *
 * @param pairs committed pairs, in the order they were formed
 * @param ignored members not placed into any pair, in the order they were set aside
 * @since 0.1.0
 */
public record PairingResult(List<MemberPair> pairs, List<String> ignored) {

  /**
   * Copies both lists.
   *
   * @throws NullPointerException if either list is {@code null}
   */
  public PairingResult {
    pairs = List.copyOf(Objects.requireNonNull(pairs, "pairs"));
    ignored = List.copyOf(Objects.requireNonNull(ignored, "ignored"));
  }

  /**
   * Returns an empty result.
   *
   * @return result with no pairs and no ignored members
   */
  public static PairingResult empty() {
    return new PairingResult(List.of(), List.of());
  }

  /**
   * Flattens pairs and ignored members into a single list (pairs first).
   *
   * @return every member mentioned by the result
   */
  public List<String> allMembers() {
    List<String> all = new ArrayList<>(pairs.size() * 2 + ignored.size());
    for (MemberPair pair : pairs) {
      all.add(pair.first());
      all.add(pair.second());
    }
    all.addAll(ignored);
    return all;
  }
}
