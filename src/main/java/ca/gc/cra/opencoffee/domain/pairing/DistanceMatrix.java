package ca.gc.cra.opencoffee.domain.pairing;

import java.util.Objects;

/**
 * <strong>What:</strong> Symmetric channel co-occurrence counts between roster members.
 * <p><strong>Role:</strong> Domain structure read by the max-distance pairing strategy.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store only the upper triangle ({@code i <= j}) in a dense array of {@code n(n+1)/2} cells.</li>
 *   <li>Canonicalize index order on every read and write so {@code distance(a, b) == distance(b, a)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe while being built; read-only afterwards.</p>
 * <p><strong>Performance:</strong> Constant-time cell access; memory grows quadratically with the roster.</p>
 *
 * @since 0.1.0
 */
public final class DistanceMatrix {
  private final MemberRoster roster;
  private final int[] cells;

  /**
   * Creates an all-zero matrix sized for {@code roster}.
   *
   * @param roster sorted roster fixing the row/column mapping; must not be {@code null}
   */
  public DistanceMatrix(MemberRoster roster) {
    this.roster = Objects.requireNonNull(roster, "roster");
    int n = roster.size();
    this.cells = new int[n * (n + 1) / 2];
  }

  /**
   * Returns the roster whose positions index this matrix.
   *
   * @return roster
   */
  public MemberRoster roster() {
    return roster;
  }

  /**
   * Returns the co-occurrence count for two roster positions.
   *
   * @param i first position
   * @param j second position
   * @return number of shared channels
   * @throws IndexOutOfBoundsException if either index is outside the roster
   */
  public int distance(int i, int j) {
    return cells[offset(i, j)];
  }

  /**
   * Returns the co-occurrence count for two members.
   *
   * @param a first member
   * @param b second member
   * @return number of shared channels
   * @throws IllegalArgumentException if either member is not on the roster
   */
  public int distance(String a, String b) {
    return distance(requireIndex(a), requireIndex(b));
  }

  /**
   * Adds one shared channel to the cell of two distinct positions.
   *
   * @param i first position
   * @param j second position
   * @throws IllegalArgumentException if {@code i == j}
   */
  public void increment(int i, int j) {
    if (i == j) {
      throw new IllegalArgumentException("diagonal cells are not tracked (index " + i + ")");
    }
    cells[offset(i, j)]++;
  }

  public int size() {
    return roster.size();
  }

  private int requireIndex(String member) {
    int index = roster.indexOf(member);
    if (index < 0) {
      throw new IllegalArgumentException("member not on roster: " + member);
    }
    return index;
  }

  private int offset(int i, int j) {
    int n = roster.size();
    if (i < 0 || j < 0 || i >= n || j >= n) {
      throw new IndexOutOfBoundsException("index (" + i + ", " + j + ") outside roster of size " + n);
    }
    int row = Math.min(i, j);
    int col = Math.max(i, j);
    // Row r starts after the r previous rows of lengths n, n-1, ..., n-r+1.
    return row * n - row * (row - 1) / 2 + (col - row);
  }
}
