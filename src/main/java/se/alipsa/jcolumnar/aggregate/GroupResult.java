package se.alipsa.jcolumnar.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finalized output of one group.
 *
 * @param keys
 *          the grouping values, empty for the global group
 * @param aggregates
 *          aggregate results in spec order
 */
public record GroupResult(List<Object> keys, List<Object> aggregates) {

  /**
   * Copying constructor; lists may contain nulls.
   */
  public GroupResult {
    keys = Collections.unmodifiableList(new ArrayList<>(keys));
    aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
  }

  /**
   * Keys followed by aggregates, the column order of a grouped result.
   *
   * @return the row values
   */
  public List<Object> values() {
    List<Object> row = new ArrayList<>(keys.size() + aggregates.size());
    row.addAll(keys);
    row.addAll(aggregates);
    return row;
  }
}
