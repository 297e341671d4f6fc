package se.alipsa.jcolumnar.window;

import java.util.Locale;
import se.alipsa.jcolumnar.aggregate.AggregateFunction;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Functions evaluated over a window.
 */
public enum WindowFunctionType {
  ROW_NUMBER, RANK, DENSE_RANK, PERCENT_RANK, CUME_DIST, NTILE,
  LAG, LEAD,
  FIRST_VALUE, LAST_VALUE,
  SUM, AVG, COUNT, MIN, MAX;

  /**
   * Resolve a function by name.
   *
   * @param name
   *          the function name, case-insensitive
   * @return the type or {@code null} if not a window function
   */
  public static WindowFunctionType from(String name) {
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
   * Whether the function numbers or buckets rows by their position.
   *
   * @return {@code true} for ROW_NUMBER, RANK, DENSE_RANK, PERCENT_RANK,
   *         CUME_DIST and NTILE
   */
  public boolean isRanking() {
    return ordinal() <= NTILE.ordinal();
  }

  /**
   * Whether the function reads values relative to the current row.
   *
   * @return {@code true} for LAG and LEAD
   */
  public boolean isOffset() {
    return this == LAG || this == LEAD;
  }

  /**
   * Whether the function aggregates over a frame.
   *
   * @return {@code true} for SUM, AVG, COUNT, MIN and MAX
   */
  public boolean isAggregate() {
    return ordinal() >= SUM.ordinal();
  }

  /**
   * Whether the frame clause affects the result.
   *
   * @return {@code true} for aggregates, FIRST_VALUE and LAST_VALUE
   */
  public boolean usesFrame() {
    return isAggregate() || this == FIRST_VALUE || this == LAST_VALUE;
  }

  /**
   * Whether a column argument is required.
   *
   * @return {@code true} unless the function is a ranking function
   */
  public boolean requiresArgument() {
    return !isRanking() && this != COUNT;
  }

  /**
   * The aggregate backing this function.
   *
   * @return the aggregate function or {@code null}
   */
  public AggregateFunction aggregateFunction() {
    return isAggregate() ? AggregateFunction.valueOf(name()) : null;
  }

  /**
   * Type of the produced values.
   *
   * @param argument
   *          the argument type, may be {@code null}
   * @return the result type
   */
  public DataType resultType(DataType argument) {
    return switch (this) {
      case ROW_NUMBER, RANK, DENSE_RANK, NTILE -> DataType.INTEGER;
      case PERCENT_RANK, CUME_DIST -> DataType.DOUBLE;
      case LAG, LEAD, FIRST_VALUE, LAST_VALUE -> argument;
      case SUM, AVG, COUNT, MIN, MAX -> aggregateFunction().resultType(argument);
    };
  }
}
