package se.alipsa.jcolumnar.predicate;

import se.alipsa.jcolumnar.store.DataType;

/**
 * Column oriented, read-only access to a batch of decoded rows.
 */
public interface BatchView {

  /**
   * Number of rows in the batch.
   *
   * @return the row count
   */
  int rowCount();

  /**
   * Resolve a column name, ignoring case.
   *
   * @param name
   *          the column name
   * @return the column index or {@code -1} when absent
   */
  int columnIndex(String name);

  /**
   * The declared type of a column.
   *
   * @param column
   *          the column index
   * @return the type, or {@code null} when unknown
   */
  DataType columnType(int column);

  /**
   * Read a value.
   *
   * @param column
   *          the column index
   * @param row
   *          the row index
   * @return the value or {@code null}
   */
  Object value(int column, int row);
}
