package se.alipsa.jcolumnar.window;

import java.util.List;
import se.alipsa.jcolumnar.plan.SortKey;

/**
 * Rows sharing one PARTITION BY key, in window order.
 *
 * <p>
 * Position {@code i} of the partition refers to input row {@link #row(int)};
 * positions follow the ORDER BY keys with ties kept in input order, so the
 * assignment of row numbers is deterministic.
 * </p>
 */
public final class WindowPartition {

  private final int[] rows;
  private final Object[][] orderValues;
  private final List<SortKey> orderBy;
  private final int[] peerStarts;
  private final int[] peerEnds;

  WindowPartition(int[] rows, Object[][] orderValues, List<SortKey> orderBy) {
    this.rows = rows;
    this.orderValues = orderValues;
    this.orderBy = orderBy;
    this.peerStarts = new int[rows.length];
    this.peerEnds = new int[rows.length];
    int groupStart = 0;
    for (int i = 1; i <= rows.length; i++) {
      if (i == rows.length || !isPeer(i - 1, i)) {
        for (int p = groupStart; p < i; p++) {
          peerStarts[p] = groupStart;
          peerEnds[p] = i;
        }
        groupStart = i;
      }
    }
  }

  public int size() {
    return rows.length;
  }

  /**
   * Input row at a partition position.
   *
   * @param position
   *          the position in window order
   * @return the row index in the window input
   */
  public int row(int position) {
    return rows[position];
  }

  /**
   * Value of an ORDER BY key at a position.
   *
   * @param position
   *          the position in window order
   * @param key
   *          the ORDER BY key index
   * @return the key value
   */
  public Object orderValue(int position, int key) {
    return orderValues[position][key];
  }

  List<SortKey> orderBy() {
    return orderBy;
  }

  /**
   * Whether two positions are peers, i.e. equal in every ORDER BY key. Without
   * ORDER BY all rows are peers.
   *
   * @param a
   *          first position
   * @param b
   *          second position
   * @return {@code true} for peers
   */
  public boolean isPeer(int a, int b) {
    for (int k = 0; k < orderBy.size(); k++) {
      if (orderBy.get(k).compare(orderValues[a][k], orderValues[b][k]) != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Start of the peer group containing a position.
   *
   * @param position
   *          the position
   * @return the first position of its peer group
   */
  int peerStart(int position) {
    return peerStarts[position];
  }

  /**
   * Exclusive end of the peer group containing a position.
   *
   * @param position
   *          the position
   * @return one past the last position of its peer group
   */
  int peerEnd(int position) {
    return peerEnds[position];
  }
}
