package ca.gc.cra.opencoffee.domain.pairing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Deduplicated, lexicographically sorted members considered for one pairing run.
 * <p><strong>Role:</strong> Domain aggregate whose positions index the {@link DistanceMatrix}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fix a stable member order for the lifetime of a run.</li>
 *   <li>Resolve member positions by binary search.</li>
 *   <li>Hand out mutable working copies without exposing its own storage.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class MemberRoster {
  private static final MemberRoster EMPTY = new MemberRoster(List.of());

  private final List<String> members;

  private MemberRoster(List<String> sortedDistinct) {
    this.members = sortedDistinct;
  }

  /**
   * Builds a roster from arbitrary member identifiers.
   *
   * @param members identifiers in any order, duplicates allowed; must not contain {@code null} or blanks
   * @return sorted, deduplicated roster
   * @throws NullPointerException if {@code members} or an element is {@code null}
   * @throws IllegalArgumentException if an element is blank
   */
  public static MemberRoster of(Collection<String> members) {
    Objects.requireNonNull(members, "members");
    TreeSet<String> sorted = new TreeSet<>();
    for (String member : members) {
      Objects.requireNonNull(member, "member");
      if (member.isBlank()) {
        throw new IllegalArgumentException("member identifiers must not be blank");
      }
      sorted.add(member);
    }
    return new MemberRoster(List.copyOf(sorted));
  }

  /**
   * Convenience factory for literal member lists.
   *
   * @param members member identifiers
   * @return sorted, deduplicated roster
   */
  public static MemberRoster of(String... members) {
    return of(List.of(members));
  }

  /**
   * Returns the empty roster.
   *
   * @return roster with no members
   */
  public static MemberRoster empty() {
    return EMPTY;
  }

  /**
   * Returns the sorted members.
   *
   * @return immutable sorted list
   */
  public List<String> members() {
    return members;
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  /**
   * Returns the member at a roster position.
   *
   * @param index zero-based position
   * @return member identifier
   */
  public String get(int index) {
    return members.get(index);
  }

  /**
   * Resolves the position of a member.
   *
   * @param member member identifier
   * @return zero-based index, or a negative value when the member is not on the roster
   */
  public int indexOf(String member) {
    if (member == null) {
      return -1;
    }
    return Collections.binarySearch(members, member);
  }

  public boolean contains(String member) {
    return indexOf(member) >= 0;
  }

  /**
   * Creates a mutable copy for strategies to consume.
   *
   * @return new {@link ArrayList} holding the members in roster order
   */
  public List<String> workingCopy() {
    return new ArrayList<>(members);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof MemberRoster other && members.equals(other.members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public String toString() {
    return "MemberRoster" + members;
  }
}
