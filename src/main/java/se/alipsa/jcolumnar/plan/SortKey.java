package se.alipsa.jcolumnar.plan;

import java.util.Objects;
import se.alipsa.jcolumnar.store.Values;

/**
 * One ORDER BY component.
 *
 * @param column
 *          the column to order by
 * @param ascending
 *          {@code true} for ascending order
 * @param nullOrdering
 *          placement of nulls
 */
public record SortKey(String column, boolean ascending, NullOrdering nullOrdering) {

  /**
   * Validating constructor.
   */
  public SortKey {
    Objects.requireNonNull(column, "column");
    nullOrdering = nullOrdering == null ? NullOrdering.DEFAULT : nullOrdering;
  }

  public static SortKey asc(String column) {
    return new SortKey(column, true, NullOrdering.DEFAULT);
  }

  public static SortKey desc(String column) {
    return new SortKey(column, false, NullOrdering.DEFAULT);
  }

  /**
   * Copy of this key with an explicit null placement.
   *
   * @param ordering
   *          the null placement
   * @return the new key
   */
  public SortKey nulls(NullOrdering ordering) {
    return new SortKey(column, ascending, ordering);
  }

  /**
   * Whether nulls sort before all other values under this key.
   *
   * @return {@code true} if nulls come first
   */
  public boolean nullsFirst() {
    return switch (nullOrdering) {
      case NULLS_FIRST -> true;
      case NULLS_LAST -> false;
      case DEFAULT -> !ascending;
    };
  }

  /**
   * Compare two values of the key column in output order.
   *
   * @param left
   *          left value, may be {@code null}
   * @param right
   *          right value, may be {@code null}
   * @return negative if {@code left} sorts first
   */
  public int compare(Object left, Object right) {
    if (left == null || right == null) {
      if (left == right) {
        return 0;
      }
      boolean first = nullsFirst();
      return left == null ? (first ? -1 : 1) : (first ? 1 : -1);
    }
    int cmp = Values.compare(left, right);
    return ascending ? cmp : -cmp;
  }

  @Override
  public String toString() {
    return column + (ascending ? " ASC" : " DESC")
        + (nullOrdering == NullOrdering.DEFAULT ? "" : " " + nullOrdering.name().replace('_', ' '));
  }
}
