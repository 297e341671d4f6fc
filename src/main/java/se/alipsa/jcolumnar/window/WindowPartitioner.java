package se.alipsa.jcolumnar.window;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.predicate.BatchView;

/**
 * Build phase of window evaluation: groups input rows by their PARTITION BY
 * values and sorts every partition stably by the ORDER BY keys.
 */
public final class WindowPartitioner {

  private WindowPartitioner() {
  }

  /**
   * Partition and sort rows.
   *
   * @param input
   *          the window input
   * @param partitionBy
   *          partition columns, may be empty
   * @param orderBy
   *          ORDER BY keys, may be empty
   * @return the partitions in order of first appearance
   */
  public static List<WindowPartition> partition(BatchView input, List<String> partitionBy, List<SortKey> orderBy) {
    int[] partitionColumns = resolve(input, partitionBy);
    int[] orderColumns = new int[orderBy.size()];
    for (int i = 0; i < orderColumns.length; i++) {
      orderColumns[i] = resolve(input, orderBy.get(i).column());
    }
    Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
    for (int row = 0; row < input.rowCount(); row++) {
      List<Object> key = new ArrayList<>(partitionColumns.length);
      for (int col : partitionColumns) {
        key.add(input.value(col, row));
      }
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    }
    List<WindowPartition> partitions = new ArrayList<>(groups.size());
    for (List<Integer> members : groups.values()) {
      partitions.add(sort(input, members, orderColumns, orderBy));
    }
    return partitions;
  }

  private static WindowPartition sort(BatchView input, List<Integer> members, int[] orderColumns,
      List<SortKey> orderBy) {
    int size = members.size();
    Object[][] keys = new Object[size][];
    Integer[] positions = new Integer[size];
    for (int i = 0; i < size; i++) {
      int row = members.get(i);
      Object[] values = new Object[orderColumns.length];
      for (int k = 0; k < orderColumns.length; k++) {
        values[k] = input.value(orderColumns[k], row);
      }
      keys[i] = values;
      positions[i] = i;
    }
    if (!orderBy.isEmpty()) {
      Comparator<Integer> byKeys = (a, b) -> {
        for (int k = 0; k < orderColumns.length; k++) {
          int cmp = orderBy.get(k).compare(keys[a][k], keys[b][k]);
          if (cmp != 0) {
            return cmp;
          }
        }
        return 0;
      };
      // object sort is stable, equal keys keep input order
      Arrays.sort(positions, byKeys);
    }
    int[] rows = new int[size];
    Object[][] sortedKeys = new Object[size][];
    for (int i = 0; i < size; i++) {
      rows[i] = members.get(positions[i]);
      sortedKeys[i] = keys[positions[i]];
    }
    return new WindowPartition(rows, sortedKeys, orderBy);
  }

  private static int[] resolve(BatchView input, List<String> columns) {
    int[] idx = new int[columns.size()];
    for (int i = 0; i < idx.length; i++) {
      idx[i] = resolve(input, columns.get(i));
    }
    return idx;
  }

  private static int resolve(BatchView input, String column) {
    int idx = input.columnIndex(column);
    if (idx < 0) {
      throw new PlanException("window", null, column, "Unknown column in window specification");
    }
    return idx;
  }
}
