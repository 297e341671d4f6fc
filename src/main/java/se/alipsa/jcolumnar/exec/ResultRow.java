package se.alipsa.jcolumnar.exec;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import se.alipsa.jcolumnar.plan.ResultColumn;

/**
 * One output row: column name to typed value. {@link #END_OF_STREAM} marks the
 * end of a result stream.
 */
public final class ResultRow {

  /** Marker returned by {@link ResultReader#read()} after the last row. */
  public static final ResultRow END_OF_STREAM = new ResultRow(List.of(), new Object[0]);

  private final List<ResultColumn> columns;
  private final Object[] values;

  ResultRow(List<ResultColumn> columns, Object[] values) {
    this.columns = columns;
    this.values = values;
  }

  /**
   * Whether this is the end of stream marker.
   *
   * @return {@code true} for {@link #END_OF_STREAM}
   */
  public boolean isEndOfStream() {
    return this == END_OF_STREAM;
  }

  /**
   * Value by position.
   *
   * @param index
   *          the column position
   * @return the value
   */
  public Object get(int index) {
    return values[index];
  }

  /**
   * Value by column name, ignoring case.
   *
   * @param column
   *          the column name
   * @return the value
   * @throws IllegalArgumentException
   *           if the row has no such column
   */
  public Object get(String column) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).name().equalsIgnoreCase(column)) {
        return values[i];
      }
    }
    throw new IllegalArgumentException("No column " + column + " in " + columns);
  }

  public List<ResultColumn> columns() {
    return columns;
  }

  /**
   * All values in column order.
   *
   * @return an unmodifiable view, may contain nulls
   */
  public List<Object> values() {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  @Override
  public String toString() {
    return isEndOfStream() ? "END_OF_STREAM" : Arrays.toString(values);
  }
}
