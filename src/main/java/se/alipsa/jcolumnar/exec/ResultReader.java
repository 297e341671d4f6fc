package se.alipsa.jcolumnar.exec;

import java.util.List;

/**
 * Streams the rows of a result, then {@link ResultRow#END_OF_STREAM}.
 */
public final class ResultReader {

  private final List<ResultRow> rows;
  private int position;

  ResultReader(List<ResultRow> rows) {
    this.rows = rows;
  }

  /**
   * Next row.
   *
   * @return the next row, or {@link ResultRow#END_OF_STREAM} once all rows
   *         were read (and on every later call)
   */
  public ResultRow read() {
    if (position >= rows.size()) {
      return ResultRow.END_OF_STREAM;
    }
    return rows.get(position++);
  }
}
