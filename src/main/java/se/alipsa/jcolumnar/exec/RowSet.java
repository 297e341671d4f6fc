package se.alipsa.jcolumnar.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.jcolumnar.plan.ResultColumn;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.plan.ProjectItem;
import se.alipsa.jcolumnar.predicate.BatchView;
import se.alipsa.jcolumnar.predicate.SelectionVector;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.TableSchema;

/**
 * Materialized intermediate result passed between operators. Immutable; every
 * transformation returns a new instance.
 */
public final class RowSet implements BatchView {

  private final List<ResultColumn> columns;
  private final List<Object[]> rows;
  private final Map<String, Integer> index;

  /**
   * Create a row set.
   *
   * @param columns
   *          the column layout
   * @param rows
   *          the rows, each with one value per column
   */
  public RowSet(List<ResultColumn> columns, List<Object[]> rows) {
    this.columns = List.copyOf(columns);
    this.rows = Collections.unmodifiableList(rows);
    Map<String, Integer> idx = new HashMap<>();
    for (int i = 0; i < this.columns.size(); i++) {
      idx.putIfAbsent(TableSchema.normalize(this.columns.get(i).name()), i);
    }
    this.index = idx;
  }

  /**
   * Row set without rows.
   *
   * @param columns
   *          the column layout
   * @return the empty row set
   */
  public static RowSet empty(List<ResultColumn> columns) {
    return new RowSet(columns, List.of());
  }

  public List<ResultColumn> columns() {
    return columns;
  }

  /**
   * A row by position.
   *
   * @param row
   *          the row index
   * @return the values, not to be modified
   */
  public Object[] row(int row) {
    return rows.get(row);
  }

  @Override
  public int rowCount() {
    return rows.size();
  }

  @Override
  public int columnIndex(String name) {
    Integer idx = index.get(TableSchema.normalize(name));
    return idx == null ? -1 : idx;
  }

  @Override
  public DataType columnType(int column) {
    return columns.get(column).type();
  }

  @Override
  public Object value(int column, int row) {
    return rows.get(row)[column];
  }

  /**
   * Keep the selected rows.
   *
   * @param selection
   *          the selection over this row set
   * @return the selected rows in order
   */
  public RowSet select(SelectionVector selection) {
    List<Object[]> kept = new ArrayList<>(selection.count());
    for (int idx : selection.indices()) {
      kept.add(rows.get(idx));
    }
    return new RowSet(columns, kept);
  }

  /**
   * Append computed columns.
   *
   * @param extra
   *          the new columns
   * @param values
   *          one value array per new column, indexed by row
   * @return the widened row set
   */
  public RowSet withColumns(List<ResultColumn> extra, List<Object[]> values) {
    List<ResultColumn> layout = new ArrayList<>(columns);
    layout.addAll(extra);
    List<Object[]> widened = new ArrayList<>(rows.size());
    for (int r = 0; r < rows.size(); r++) {
      Object[] source = rows.get(r);
      Object[] row = new Object[layout.size()];
      System.arraycopy(source, 0, row, 0, source.length);
      for (int c = 0; c < values.size(); c++) {
        row[source.length + c] = values.get(c)[r];
      }
      widened.add(row);
    }
    return new RowSet(layout, widened);
  }

  /**
   * Stable sort.
   *
   * @param keys
   *          the sort keys
   * @return the sorted row set
   */
  public RowSet sort(List<SortKey> keys) {
    int[] idx = new int[keys.size()];
    for (int i = 0; i < idx.length; i++) {
      idx[i] = columnIndex(keys.get(i).column());
    }
    Comparator<Object[]> comparator = (a, b) -> {
      for (int i = 0; i < idx.length; i++) {
        int cmp = keys.get(i).compare(a[idx[i]], b[idx[i]]);
        if (cmp != 0) {
          return cmp;
        }
      }
      return 0;
    };
    List<Object[]> sorted = new ArrayList<>(rows);
    // List.sort is a stable merge sort
    sorted.sort(comparator);
    return new RowSet(columns, sorted);
  }

  /**
   * Skip and truncate.
   *
   * @param count
   *          maximum number of rows
   * @param offset
   *          rows to skip
   * @return the slice
   */
  public RowSet limit(long count, long offset) {
    int from = (int) Math.min(rows.size(), offset);
    int to = (int) Math.min(rows.size(), from + Math.min(count, Integer.MAX_VALUE));
    return new RowSet(columns, new ArrayList<>(rows.subList(from, to)));
  }

  /**
   * Select and rename columns.
   *
   * @param items
   *          the output columns
   * @return the projected row set
   */
  public RowSet project(List<ProjectItem> items) {
    int[] idx = new int[items.size()];
    List<ResultColumn> layout = new ArrayList<>(items.size());
    for (int i = 0; i < idx.length; i++) {
      idx[i] = columnIndex(items.get(i).column());
      layout.add(new ResultColumn(items.get(i).alias(), columns.get(idx[i]).type()));
    }
    List<Object[]> projected = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      Object[] out = new Object[idx.length];
      for (int i = 0; i < idx.length; i++) {
        out[i] = row[idx[i]];
      }
      projected.add(out);
    }
    return new RowSet(layout, projected);
  }
}
