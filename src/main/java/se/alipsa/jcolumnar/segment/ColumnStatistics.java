package se.alipsa.jcolumnar.segment;

import java.util.Set;

/**
 * Statistics of one column within one segment. Immutable once the segment is
 * published.
 *
 * @param rowCount
 *          number of rows, nulls included
 * @param nullCount
 *          number of null rows
 * @param min
 *          smallest non-null value or {@code null} if all rows are null
 * @param max
 *          largest non-null value or {@code null} if all rows are null
 * @param distinctEstimate
 *          number of distinct non-null values
 * @param distinctValues
 *          the distinct non-null values when their number does not exceed the
 *          dictionary threshold, otherwise {@code null}
 */
public record ColumnStatistics(int rowCount, int nullCount, Object min, Object max, int distinctEstimate,
    Set<Object> distinctValues) {

  /**
   * Validating constructor.
   */
  public ColumnStatistics {
    if (nullCount < 0 || nullCount > rowCount) {
      throw new IllegalArgumentException("nullCount " + nullCount + " out of range for " + rowCount + " rows");
    }
    distinctValues = distinctValues == null ? null : Set.copyOf(distinctValues);
  }

  /**
   * Whether every row is null.
   *
   * @return {@code true} if no non-null value exists
   */
  public boolean allNull() {
    return nullCount == rowCount;
  }

  /**
   * Whether the exact distinct value set is retained.
   *
   * @return {@code true} if {@link #distinctValues()} is available
   */
  public boolean hasDistinctValues() {
    return distinctValues != null;
  }
}
