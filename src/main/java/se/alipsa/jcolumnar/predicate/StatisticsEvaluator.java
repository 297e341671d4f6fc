package se.alipsa.jcolumnar.predicate;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.jcolumnar.predicate.Operand.ColumnRef;
import se.alipsa.jcolumnar.predicate.Operand.Literal;
import se.alipsa.jcolumnar.segment.ColumnStatistics;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.Values;

/**
 * Decides from segment statistics whether a predicate could be TRUE for any
 * row of a segment.
 *
 * <p>
 * The answer is conservative: {@code false} is returned only when no row can
 * match. Anything the evaluator does not understand (column to column
 * comparisons, unknown columns, incomparable literals) counts as a possible
 * match. Negations are pushed down to the leaves first, so {@code NOT (a < 5)}
 * is checked as {@code a >= 5}; this preserves the set of rows for which the
 * predicate is TRUE under three-valued logic.
 * </p>
 */
public final class StatisticsEvaluator {

  private StatisticsEvaluator() {
  }

  /**
   * Per segment access to column statistics.
   */
  public interface StatisticsSource {

    /**
     * Statistics of a column.
     *
     * @param column
     *          the column name
     * @return the statistics or {@code null} when the column is unknown
     */
    ColumnStatistics statistics(String column);

    /**
     * Declared type of a column.
     *
     * @param column
     *          the column name
     * @return the type or {@code null} when the column is unknown
     */
    DataType type(String column);
  }

  /**
   * Check whether a predicate may match a segment.
   *
   * @param predicate
   *          the predicate, {@code null} always matches
   * @param source
   *          the segment statistics
   * @return {@code false} only if the predicate is provably never TRUE
   */
  public static boolean mayMatch(Predicate predicate, StatisticsSource source) {
    if (predicate == null) {
      return true;
    }
    return check(pushNegation(predicate, false), source);
  }

  private static Predicate pushNegation(Predicate predicate, boolean negate) {
    if (predicate instanceof Predicate.Not not) {
      return pushNegation(not.predicate(), !negate);
    }
    if (!negate) {
      if (predicate instanceof Predicate.And and) {
        return new Predicate.And(pushNegation(and.left(), false), pushNegation(and.right(), false));
      }
      if (predicate instanceof Predicate.Or or) {
        return new Predicate.Or(pushNegation(or.left(), false), pushNegation(or.right(), false));
      }
      return predicate;
    }
    if (predicate instanceof Predicate.And and) {
      return new Predicate.Or(pushNegation(and.left(), true), pushNegation(and.right(), true));
    }
    if (predicate instanceof Predicate.Or or) {
      return new Predicate.And(pushNegation(or.left(), true), pushNegation(or.right(), true));
    }
    if (predicate instanceof Predicate.Comparison cmp) {
      return new Predicate.Comparison(cmp.operator().negate(), cmp.left(), cmp.right());
    }
    if (predicate instanceof Predicate.Between between) {
      return new Predicate.Between(between.operand(), between.low(), between.high(), !between.negated());
    }
    if (predicate instanceof Predicate.In in) {
      return new Predicate.In(in.operand(), in.values(), !in.negated());
    }
    if (predicate instanceof Predicate.IsNull isNull) {
      return new Predicate.IsNull(isNull.operand(), !isNull.negated());
    }
    return new Predicate.Not(predicate);
  }

  private static boolean check(Predicate predicate, StatisticsSource source) {
    if (predicate instanceof Predicate.And and) {
      return check(and.left(), source) && check(and.right(), source);
    }
    if (predicate instanceof Predicate.Or or) {
      return check(or.left(), source) || check(or.right(), source);
    }
    if (predicate instanceof Predicate.Comparison cmp) {
      return checkComparison(cmp, source);
    }
    if (predicate instanceof Predicate.Between between) {
      return checkBetween(between, source);
    }
    if (predicate instanceof Predicate.In in) {
      return checkIn(in, source);
    }
    if (predicate instanceof Predicate.IsNull isNull) {
      if (!(isNull.operand() instanceof ColumnRef ref)) {
        return true;
      }
      ColumnStatistics stats = source.statistics(ref.name());
      if (stats == null) {
        return true;
      }
      return isNull.negated() ? stats.nullCount() < stats.rowCount() : stats.nullCount() > 0;
    }
    return true;
  }

  private static boolean checkComparison(Predicate.Comparison cmp, StatisticsSource source) {
    ComparisonOperator op = cmp.operator();
    Operand left = cmp.left();
    Operand right = cmp.right();
    if (left instanceof Literal && right instanceof ColumnRef) {
      op = op.flip();
      Operand tmp = left;
      left = right;
      right = tmp;
    }
    if (left instanceof Literal l && right instanceof Literal r) {
      return constantComparison(op, l.value(), r.value());
    }
    if (!(left instanceof ColumnRef ref) || !(right instanceof Literal literal)) {
      return true;
    }
    ColumnStatistics stats = source.statistics(ref.name());
    if (stats == null) {
      return true;
    }
    Object value = coerce(literal.value(), source.type(ref.name()));
    if (value == NOT_COERCIBLE) {
      return true;
    }
    if (value == null || stats.allNull()) {
      return false;
    }
    try {
      return switch (op) {
        case EQ -> Values.compare(stats.min(), value) <= 0 && Values.compare(stats.max(), value) >= 0
            && distinctMayContain(stats, value);
        case NE -> !(Values.compare(stats.min(), value) == 0 && Values.compare(stats.max(), value) == 0);
        case LT -> Values.compare(stats.min(), value) < 0;
        case LE -> Values.compare(stats.min(), value) <= 0;
        case GT -> Values.compare(stats.max(), value) > 0;
        case GE -> Values.compare(stats.max(), value) >= 0;
      };
    } catch (IllegalArgumentException e) {
      return true;
    }
  }

  private static boolean checkBetween(Predicate.Between between, StatisticsSource source) {
    if (!(between.operand() instanceof ColumnRef ref) || !(between.low() instanceof Literal low)
        || !(between.high() instanceof Literal high)) {
      return true;
    }
    ColumnStatistics stats = source.statistics(ref.name());
    if (stats == null) {
      return true;
    }
    DataType type = source.type(ref.name());
    Object lo = coerce(low.value(), type);
    Object hi = coerce(high.value(), type);
    if (lo == NOT_COERCIBLE || hi == NOT_COERCIBLE) {
      return true;
    }
    if (lo == null || hi == null || stats.allNull()) {
      return false;
    }
    try {
      if (between.negated()) {
        return Values.compare(stats.min(), lo) < 0 || Values.compare(stats.max(), hi) > 0;
      }
      return Values.compare(stats.max(), lo) >= 0 && Values.compare(stats.min(), hi) <= 0
          && Values.compare(lo, hi) <= 0;
    } catch (IllegalArgumentException e) {
      return true;
    }
  }

  private static boolean checkIn(Predicate.In in, StatisticsSource source) {
    if (!(in.operand() instanceof ColumnRef ref)) {
      return true;
    }
    ColumnStatistics stats = source.statistics(ref.name());
    if (stats == null) {
      return true;
    }
    DataType type = source.type(ref.name());
    List<Object> values = new ArrayList<>(in.values().size());
    boolean sawNull = false;
    for (Operand operand : in.values()) {
      if (!(operand instanceof Literal literal)) {
        return true;
      }
      Object value = coerce(literal.value(), type);
      if (value == NOT_COERCIBLE) {
        return true;
      }
      if (value == null) {
        sawNull = true;
      } else {
        values.add(value);
      }
    }
    if (stats.allNull()) {
      return false;
    }
    try {
      if (in.negated()) {
        // NOT IN with a NULL candidate is never TRUE
        if (sawNull) {
          return false;
        }
        if (Values.compare(stats.min(), stats.max()) != 0) {
          return true;
        }
        for (Object value : values) {
          if (Values.compare(stats.min(), value) == 0) {
            return false;
          }
        }
        return true;
      }
      for (Object value : values) {
        if (Values.compare(stats.min(), value) <= 0 && Values.compare(stats.max(), value) >= 0
            && distinctMayContain(stats, value)) {
          return true;
        }
      }
      return false;
    } catch (IllegalArgumentException e) {
      return true;
    }
  }

  private static boolean distinctMayContain(ColumnStatistics stats, Object value) {
    if (!stats.hasDistinctValues()) {
      return true;
    }
    for (Object candidate : stats.distinctValues()) {
      if (Values.comparable(candidate, value) && Values.compare(candidate, value) == 0) {
        return true;
      }
    }
    return false;
  }

  private static boolean constantComparison(ComparisonOperator op, Object left, Object right) {
    if (left == null || right == null) {
      return false;
    }
    if (!Values.comparable(left, right)) {
      return true;
    }
    return op.test(Values.compare(left, right));
  }

  private static final Object NOT_COERCIBLE = new Object();

  private static Object coerce(Object literal, DataType type) {
    try {
      return Values.coerce(literal, type);
    } catch (IllegalArgumentException e) {
      return NOT_COERCIBLE;
    }
  }
}
