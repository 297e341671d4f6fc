package se.alipsa.jcolumnar.aggregate;

import java.util.Locale;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Aggregate functions supported by grouping and by window frames.
 */
public enum AggregateFunction {
  SUM, COUNT, AVG, MIN, MAX;

  /**
   * Resolve a function by name.
   *
   * @param name
   *          the function name, case-insensitive
   * @return the function or {@code null} if the name is not an aggregate
   */
  public static AggregateFunction from(String name) {
    if (name == null) {
      return null;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /**
   * Whether the function accepts arguments of the given type.
   *
   * @param input
   *          the argument type, {@code null} for {@code COUNT(*)}
   * @return {@code true} if supported
   */
  public boolean accepts(DataType input) {
    return switch (this) {
      case SUM, AVG -> input != null && input.isNumeric();
      case COUNT -> true;
      case MIN, MAX -> input != null;
    };
  }

  /**
   * Type of the finalized result.
   *
   * @param input
   *          the argument type, {@code null} for {@code COUNT(*)}
   * @return the result type
   */
  public DataType resultType(DataType input) {
    return switch (this) {
      case COUNT -> DataType.INTEGER;
      case AVG -> DataType.DOUBLE;
      case SUM, MIN, MAX -> input;
    };
  }
}
