package se.alipsa.jcolumnar.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import se.alipsa.jcolumnar.plan.ResultColumn;

/**
 * Fixed-schema output of a query.
 *
 * <p>
 * {@link #ordered()} tells whether the row order is defined. It is only
 * {@code true} when a sort governs the output; otherwise rows come in an
 * implementation dependent order.
 * </p>
 */
public final class QueryResult {

  private final List<ResultColumn> columns;
  private final List<ResultRow> rows;
  private final QueryOutcome outcome;
  private final boolean ordered;

  private QueryResult(List<ResultColumn> columns, List<ResultRow> rows, QueryOutcome outcome, boolean ordered) {
    this.columns = List.copyOf(columns);
    this.rows = Collections.unmodifiableList(rows);
    this.outcome = outcome;
    this.ordered = ordered;
  }

  static QueryResult completed(RowSet rowSet, boolean ordered) {
    List<ResultColumn> columns = rowSet.columns();
    List<ResultRow> rows = new ArrayList<>(rowSet.rowCount());
    for (int i = 0; i < rowSet.rowCount(); i++) {
      rows.add(new ResultRow(columns, rowSet.row(i)));
    }
    return new QueryResult(columns, rows, QueryOutcome.COMPLETED, ordered);
  }

  static QueryResult cancelled(List<ResultColumn> columns) {
    return new QueryResult(columns, List.of(), QueryOutcome.CANCELLED, false);
  }

  public List<ResultColumn> columns() {
    return columns;
  }

  public QueryOutcome outcome() {
    return outcome;
  }

  public boolean ordered() {
    return ordered;
  }

  /**
   * All rows.
   *
   * @return the rows, without end marker
   */
  public List<ResultRow> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  /**
   * Stream the rows.
   *
   * @return a new reader positioned before the first row
   */
  public ResultReader reader() {
    return new ResultReader(rows);
  }

  /**
   * All values of one column in row order.
   *
   * @param column
   *          the column name
   * @return the values, may contain nulls
   */
  public List<Object> column(String column) {
    int idx = -1;
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).name().equalsIgnoreCase(column)) {
        idx = i;
        break;
      }
    }
    if (idx < 0) {
      throw new IllegalArgumentException("No column " + column + " in " + columns);
    }
    List<Object> values = new ArrayList<>(rows.size());
    for (ResultRow row : rows) {
      values.add(row.get(idx));
    }
    return values;
  }

  @Override
  public String toString() {
    return "QueryResult{" + outcome + ", " + rows.size() + " rows, columns=" + columns + "}";
  }
}
