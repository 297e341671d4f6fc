package se.alipsa.jcolumnar.aggregate;

import java.util.Objects;

/**
 * One requested aggregate.
 *
 * @param function
 *          the aggregate function
 * @param column
 *          the argument column, {@code null} for {@code COUNT(*)}
 * @param alias
 *          the output column name
 * @param distinct
 *          {@code true} to aggregate each distinct value once; only
 *          {@code COUNT(DISTINCT column)} is supported
 */
public record AggregateSpec(AggregateFunction function, String column, String alias, boolean distinct) {

  /**
   * Validating constructor.
   */
  public AggregateSpec {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(alias, "alias");
    if (column == null && function != AggregateFunction.COUNT) {
      throw new IllegalArgumentException(function + " requires a column argument");
    }
    if (distinct && (function != AggregateFunction.COUNT || column == null)) {
      throw new IllegalArgumentException("DISTINCT is only supported as COUNT(DISTINCT column), not " + function);
    }
  }

  public AggregateSpec(AggregateFunction function, String column, String alias) {
    this(function, column, alias, false);
  }

  public static AggregateSpec sum(String column, String alias) {
    return new AggregateSpec(AggregateFunction.SUM, column, alias);
  }

  public static AggregateSpec avg(String column, String alias) {
    return new AggregateSpec(AggregateFunction.AVG, column, alias);
  }

  public static AggregateSpec min(String column, String alias) {
    return new AggregateSpec(AggregateFunction.MIN, column, alias);
  }

  public static AggregateSpec max(String column, String alias) {
    return new AggregateSpec(AggregateFunction.MAX, column, alias);
  }

  public static AggregateSpec count(String column, String alias) {
    return new AggregateSpec(AggregateFunction.COUNT, column, alias);
  }

  /**
   * {@code COUNT(DISTINCT column)}: the number of distinct non-null values.
   *
   * @param column
   *          the counted column
   * @param alias
   *          the output column name
   * @return the spec
   */
  public static AggregateSpec countDistinct(String column, String alias) {
    return new AggregateSpec(AggregateFunction.COUNT, column, alias, true);
  }

  /**
   * {@code COUNT(*)}.
   *
   * @param alias
   *          the output column name
   * @return the spec
   */
  public static AggregateSpec countStar(String alias) {
    return new AggregateSpec(AggregateFunction.COUNT, null, alias);
  }

  /**
   * Whether this is {@code COUNT(*)}.
   *
   * @return {@code true} when every row counts
   */
  public boolean isCountStar() {
    return column == null;
  }

  @Override
  public String toString() {
    return function + "(" + (distinct ? "DISTINCT " : "") + (column == null ? "*" : column) + ") AS " + alias;
  }
}
