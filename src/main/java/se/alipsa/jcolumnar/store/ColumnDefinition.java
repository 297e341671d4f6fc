package se.alipsa.jcolumnar.store;

import java.util.Objects;

/**
 * Declaration of a single table column.
 *
 * @param name
 *          the column name, unique within its table (case-insensitive)
 * @param type
 *          the logical type
 * @param scale
 *          number of fractional digits for DECIMAL columns, ignored otherwise
 * @param nullable
 *          whether the column accepts {@code null}
 */
public record ColumnDefinition(String name, DataType type, int scale, boolean nullable) {

  /**
   * Validating constructor.
   */
  public ColumnDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Column name must not be blank");
    }
    if (scale < 0) {
      throw new IllegalArgumentException("Scale must not be negative for column " + name + ": " + scale);
    }
    if (type != DataType.DECIMAL) {
      scale = 0;
    }
  }

  /**
   * Nullable INTEGER column.
   *
   * @param name
   *          the column name
   * @return the definition
   */
  public static ColumnDefinition integer(String name) {
    return new ColumnDefinition(name, DataType.INTEGER, 0, true);
  }

  /**
   * Nullable DECIMAL column with the given scale.
   *
   * @param name
   *          the column name
   * @param scale
   *          number of fractional digits
   * @return the definition
   */
  public static ColumnDefinition decimal(String name, int scale) {
    return new ColumnDefinition(name, DataType.DECIMAL, scale, true);
  }

  /**
   * Nullable DOUBLE column.
   *
   * @param name
   *          the column name
   * @return the definition
   */
  public static ColumnDefinition doubleColumn(String name) {
    return new ColumnDefinition(name, DataType.DOUBLE, 0, true);
  }

  /**
   * Nullable DATE column.
   *
   * @param name
   *          the column name
   * @return the definition
   */
  public static ColumnDefinition date(String name) {
    return new ColumnDefinition(name, DataType.DATE, 0, true);
  }

  /**
   * Nullable STRING column.
   *
   * @param name
   *          the column name
   * @return the definition
   */
  public static ColumnDefinition string(String name) {
    return new ColumnDefinition(name, DataType.STRING, 0, true);
  }

  /**
   * Copy of this definition that rejects {@code null} values.
   *
   * @return a NOT NULL variant of this column
   */
  public ColumnDefinition notNull() {
    return new ColumnDefinition(name, type, scale, false);
  }
}
