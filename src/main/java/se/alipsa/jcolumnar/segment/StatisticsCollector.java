package se.alipsa.jcolumnar.segment;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import se.alipsa.jcolumnar.store.Values;

/**
 * Computes {@link ColumnStatistics} for a column slice.
 */
public final class StatisticsCollector {

  private StatisticsCollector() {
  }

  /**
   * Collect statistics.
   *
   * @param values
   *          the normalized values of one column slice
   * @param distinctLimit
   *          largest distinct count for which the value set is retained
   * @return the statistics
   */
  public static ColumnStatistics collect(List<Object> values, int distinctLimit) {
    Object min = null;
    Object max = null;
    int nulls = 0;
    Set<Object> distinct = new HashSet<>();
    for (Object value : values) {
      if (value == null) {
        nulls++;
        continue;
      }
      distinct.add(value);
      if (min == null || Values.compare(value, min) < 0) {
        min = value;
      }
      if (max == null || Values.compare(value, max) > 0) {
        max = value;
      }
    }
    Set<Object> retained = distinct.size() <= distinctLimit ? distinct : null;
    return new ColumnStatistics(values.size(), nulls, min, max, distinct.size(), retained);
  }
}
