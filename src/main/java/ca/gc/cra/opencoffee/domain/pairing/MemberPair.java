package ca.gc.cra.opencoffee.domain.pairing;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Two distinct members invited to the same coffee chat.
 * <p><strong>Role:</strong> Domain value produced by pairing strategies and replayed by the reminder action.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param first member that drove the match (the one consumed first from the working set)
 * @param second partner selected for {@code first}
 * @since 0.1.0
 */
public record MemberPair(String first, String second) {

  /**
   * Validates that both members are present and distinct.
   *
   * @throws NullPointerException if either member is {@code null}
   * @throws IllegalArgumentException if both members are equal
   */
  public MemberPair {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    if (first.equals(second)) {
      throw new IllegalArgumentException("a member cannot be paired with itself: " + first);
    }
  }

  /**
   * Returns the pair with the lexicographically smaller member first.
   *
   * @return canonical pair; {@code this} when already canonical
   */
  public MemberPair canonical() {
    return first.compareTo(second) <= 0 ? this : new MemberPair(second, first);
  }

  /**
   * Checks whether the pair contains the given member.
   *
   * @param member member identifier
   * @return {@code true} when {@code member} is either side of the pair
   */
  public boolean contains(String member) {
    return first.equals(member) || second.equals(member);
  }

  /**
   * Returns both members in pair order.
   *
   * @return two-element immutable list
   */
  public List<String> members() {
    return List.of(first, second);
  }

  @Override
  public String toString() {
    return "(" + first + ", " + second + ")";
  }
}
