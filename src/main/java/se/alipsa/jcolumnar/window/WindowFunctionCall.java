package se.alipsa.jcolumnar.window;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.store.DataType;

/**
 * One window function call: function, argument, OVER clause and output name.
 *
 * @param function
 *          the function
 * @param argument
 *          the argument column, {@code null} for ranking functions and
 *          {@code COUNT(*)}
 * @param parameter
 *          bucket count for NTILE, row offset for LAG and LEAD, otherwise
 *          {@code null}
 * @param defaultValue
 *          LAG / LEAD value used outside the partition, may be {@code null}
 * @param window
 *          the OVER clause
 * @param alias
 *          the output column name
 */
public record WindowFunctionCall(WindowFunctionType function, String argument, Long parameter, Object defaultValue,
    WindowSpec window, String alias) {

  private static final String STAGE = "window";

  /**
   * Null checking constructor.
   */
  public WindowFunctionCall {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(alias, "alias");
    if (function.isOffset() && parameter == null) {
      parameter = 1L;
    }
  }

  public static WindowFunctionCall rowNumber(WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.ROW_NUMBER, null, null, null, window, alias);
  }

  public static WindowFunctionCall rank(WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.RANK, null, null, null, window, alias);
  }

  public static WindowFunctionCall denseRank(WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.DENSE_RANK, null, null, null, window, alias);
  }

  public static WindowFunctionCall percentRank(WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.PERCENT_RANK, null, null, null, window, alias);
  }

  public static WindowFunctionCall cumeDist(WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.CUME_DIST, null, null, null, window, alias);
  }

  public static WindowFunctionCall ntile(long buckets, WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.NTILE, null, buckets, null, window, alias);
  }

  public static WindowFunctionCall lag(String column, long offset, Object defaultValue, WindowSpec window,
      String alias) {
    return new WindowFunctionCall(WindowFunctionType.LAG, column, offset, defaultValue, window, alias);
  }

  public static WindowFunctionCall lead(String column, long offset, Object defaultValue, WindowSpec window,
      String alias) {
    return new WindowFunctionCall(WindowFunctionType.LEAD, column, offset, defaultValue, window, alias);
  }

  public static WindowFunctionCall firstValue(String column, WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.FIRST_VALUE, column, null, null, window, alias);
  }

  public static WindowFunctionCall lastValue(String column, WindowSpec window, String alias) {
    return new WindowFunctionCall(WindowFunctionType.LAST_VALUE, column, null, null, window, alias);
  }

  /**
   * Frame aggregate call.
   *
   * @param function
   *          SUM, AVG, COUNT, MIN or MAX
   * @param column
   *          the argument, {@code null} for {@code COUNT(*)}
   * @param window
   *          the OVER clause
   * @param alias
   *          output name
   * @return the call
   */
  public static WindowFunctionCall aggregate(WindowFunctionType function, String column, WindowSpec window,
      String alias) {
    if (!function.isAggregate()) {
      throw new IllegalArgumentException(function + " is not an aggregate");
    }
    return new WindowFunctionCall(function, column, null, null, window, alias);
  }

  /**
   * Identity of the computation, ignoring the output name. Calls with equal
   * keys produce identical values and are evaluated once.
   *
   * @return the computation key
   */
  ComputationKey computationKey() {
    return new ComputationKey(function, argument == null ? null : argument.toLowerCase(Locale.ROOT),
        parameter, defaultValue, window);
  }

  record ComputationKey(WindowFunctionType function, String argument, Long parameter, Object defaultValue,
      WindowSpec window) {
  }

  /**
   * Check the call against the columns of its input.
   *
   * @param types
   *          column type lookup returning {@code null} for unknown columns
   * @throws PlanException
   *           for unknown columns, missing ORDER BY on ranking functions and
   *           invalid NTILE, LAG or LEAD parameters
   * @throws se.alipsa.jcolumnar.error.InvalidFrameSpecException
   *           for malformed frames
   */
  public void validate(Function<String, DataType> types) {
    if (function.requiresArgument() && argument == null) {
      throw new PlanException(STAGE, null, alias, function + " requires a column argument");
    }
    if (argument != null) {
      DataType type = types.apply(argument);
      if (type == null) {
        throw new PlanException(STAGE, null, argument,
            "Window argument of " + alias + " is not produced by the window input");
      }
      if (function.isAggregate() && !function.aggregateFunction().accepts(type)) {
        throw new PlanException(STAGE, null, argument, function + " does not accept " + type + " arguments");
      }
    }
    for (String column : window.partitionBy()) {
      if (types.apply(column) == null) {
        throw new PlanException(STAGE, null, column, "Unknown PARTITION BY column");
      }
    }
    for (SortKey key : window.orderBy()) {
      if (types.apply(key.column()) == null) {
        throw new PlanException(STAGE, null, key.column(), "Unknown ORDER BY column");
      }
    }
    if (function.isRanking() && function != WindowFunctionType.ROW_NUMBER && window.orderBy().isEmpty()) {
      throw new PlanException(STAGE, null, alias, function + " requires ORDER BY in its window");
    }
    if (function == WindowFunctionType.NTILE && (parameter == null || parameter <= 0)) {
      throw new PlanException(STAGE, null, alias, "NTILE bucket count must be positive but was " + parameter);
    }
    if (function.isOffset() && parameter < 0) {
      throw new PlanException(STAGE, null, alias, function + " offset must not be negative but was " + parameter);
    }
    if (window.frame() != null) {
      window.frame().validate(window.orderBy(), types, alias);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(function.name()).append('(');
    if (argument != null) {
      sb.append(argument);
    } else if (function == WindowFunctionType.COUNT) {
      sb.append('*');
    }
    if (parameter != null) {
      sb.append(argument == null ? "" : ", ").append(parameter);
    }
    if (defaultValue != null) {
      sb.append(", ").append(defaultValue);
    }
    return sb.append(") ").append(window).append(" AS ").append(alias).toString();
  }
}
