package se.alipsa.jcolumnar.predicate;

import java.util.Objects;

/**
 * Leaf of an expression tree: either a column reference or a literal.
 */
public interface Operand {

  /**
   * Reference to a column of the input batch.
   *
   * @param name
   *          the column name (case-insensitive)
   */
  record ColumnRef(String name) implements Operand {
    public ColumnRef {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Constant value. Strings compared with DATE columns are parsed as ISO dates.
   *
   * @param value
   *          the value, may be {@code null}
   */
  record Literal(Object value) implements Operand {
    @Override
    public String toString() {
      if (value == null) {
        return "NULL";
      }
      return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
  }
}
