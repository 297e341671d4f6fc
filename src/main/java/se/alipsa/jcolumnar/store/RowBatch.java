package se.alipsa.jcolumnar.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable batch of rows to append to a table. The batch names its columns
 * explicitly; the column set has to match the table schema exactly, although
 * the order may differ.
 */
public final class RowBatch {

  private final List<String> columns;
  private final List<Object[]> rows;

  private RowBatch(List<String> columns, List<Object[]> rows) {
    this.columns = List.copyOf(columns);
    this.rows = Collections.unmodifiableList(rows);
  }

  /**
   * Start building a batch with the given column names.
   *
   * @param columns
   *          the column names, in the order values are supplied per row
   * @return a new builder
   */
  public static Builder builder(String... columns) {
    return new Builder(Arrays.asList(columns));
  }

  /**
   * Start building a batch with the given column names.
   *
   * @param columns
   *          the column names, in the order values are supplied per row
   * @return a new builder
   */
  public static Builder builder(List<String> columns) {
    return new Builder(columns);
  }

  public List<String> columns() {
    return columns;
  }

  /**
   * Number of rows in the batch.
   *
   * @return the row count
   */
  public int size() {
    return rows.size();
  }

  /**
   * Whether the batch has no rows.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Read one value.
   *
   * @param row
   *          the row index within the batch
   * @param column
   *          the column position as declared by {@link #columns()}
   * @return the value, may be {@code null}
   */
  public Object value(int row, int column) {
    return rows.get(row)[column];
  }

  /**
   * Copy of one row.
   *
   * @param row
   *          the row index
   * @return the values in {@link #columns()} order
   */
  public Object[] row(int row) {
    return rows.get(row).clone();
  }

  /**
   * Mutable builder for {@link RowBatch}.
   */
  public static final class Builder {
    private final List<String> columns;
    private final List<Object[]> rows = new ArrayList<>();

    private Builder(List<String> columns) {
      Objects.requireNonNull(columns, "columns");
      if (columns.isEmpty()) {
        throw new IllegalArgumentException("A row batch requires at least one column");
      }
      this.columns = List.copyOf(columns);
    }

    /**
     * Append one row.
     *
     * @param values
     *          the values in column order
     * @return {@code this} for chaining
     */
    public Builder row(Object... values) {
      if (values == null || values.length != columns.size()) {
        throw new IllegalArgumentException("Expected " + columns.size() + " values per row but received "
            + (values == null ? 0 : values.length));
      }
      rows.add(values.clone());
      return this;
    }

    /**
     * Build the batch.
     *
     * @return the immutable batch
     */
    public RowBatch build() {
      return new RowBatch(columns, new ArrayList<>(rows));
    }
  }
}
