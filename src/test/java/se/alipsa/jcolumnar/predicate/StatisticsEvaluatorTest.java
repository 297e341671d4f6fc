package se.alipsa.jcolumnar.predicate;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.predicate.StatisticsEvaluator.StatisticsSource;
import se.alipsa.jcolumnar.segment.ColumnStatistics;
import se.alipsa.jcolumnar.segment.StatisticsCollector;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Tests for deciding segment relevance from column statistics.
 */
class StatisticsEvaluatorTest {

  private record Source(Map<String, ColumnStatistics> statistics, Map<String, DataType> types)
      implements StatisticsSource {

    @Override
    public ColumnStatistics statistics(String column) {
      return statistics.get(column);
    }

    @Override
    public DataType type(String column) {
      return types.get(column);
    }
  }

  /** Values 10..20 with a null, plus a June date range and a small string set. */
  private static final StatisticsSource SEGMENT = new Source(
      Map.of("n", StatisticsCollector.collect(Arrays.asList(10L, 15L, null, 20L), 2),
          "day", StatisticsCollector.collect(Arrays.asList(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 30)), 0),
          "s", StatisticsCollector.collect(Arrays.asList("apple", "pear"), 10),
          "empty", StatisticsCollector.collect(Arrays.asList(null, null), 10)),
      Map.of("n", DataType.INTEGER, "day", DataType.DATE, "s", DataType.STRING, "empty", DataType.INTEGER));

  private static boolean may(Predicate predicate) {
    return StatisticsEvaluator.mayMatch(predicate, SEGMENT);
  }

  /**
   * Range comparisons use min and max.
   */
  @Test
  void rangeComparisons() {
    Assertions.assertFalse(may(Predicates.lt("n", 10)), "min is 10");
    Assertions.assertTrue(may(Predicates.le("n", 10)));
    Assertions.assertFalse(may(Predicates.gt("n", 20)), "max is 20");
    Assertions.assertTrue(may(Predicates.ge("n", 20)));
    Assertions.assertFalse(may(Predicates.eq("n", 25)));
    Assertions.assertTrue(may(Predicates.eq("n", 12)), "No distinct set retained for n, so 12 may exist");
  }

  /**
   * A retained distinct set excludes values inside the min/max range that are
   * not present.
   */
  @Test
  void distinctSetExcludesMissingValues() {
    Assertions.assertFalse(may(Predicates.eq("s", "banana")), "banana sorts between apple and pear");
    Assertions.assertTrue(may(Predicates.eq("s", "pear")));
    Assertions.assertFalse(may(Predicates.in("s", "banana", "cherry")));
    Assertions.assertTrue(may(Predicates.in("s", "banana", "apple")));
  }

  /**
   * A literal on the left is handled by flipping the comparison.
   */
  @Test
  void literalOnTheLeftIsFlipped() {
    Predicate predicate = new Predicate.Comparison(ComparisonOperator.GT, Predicates.lit(10), Predicates.col("n"));
    Assertions.assertFalse(may(predicate), "10 > n never holds when min is 10");
  }

  /**
   * Date ranges coerce ISO string literals.
   */
  @Test
  void dateRangesPrune() {
    Assertions.assertTrue(may(Predicates.between("day", "2024-06-10", "2024-07-10")));
    Assertions.assertFalse(may(Predicates.between("day", "2024-07-01", "2024-07-31")));
    Assertions.assertFalse(may(Predicates.notBetween("day", "2024-05-01", "2024-07-31")));
  }

  /**
   * Negations are pushed through AND and OR before checking the leaves.
   */
  @Test
  void negationIsPushedDown() {
    Assertions.assertFalse(may(Predicates.not(Predicates.ge("n", 10))), "NOT n >= 10 is n < 10");
    Assertions.assertFalse(may(Predicates.not(Predicates.and(Predicates.ge("n", 10), Predicates.le("n", 20)))),
        "Checked as n < 10 OR n > 20; the null row only yields UNKNOWN");
    Assertions.assertFalse(may(Predicates.not(Predicates.or(Predicates.ge("n", 10), Predicates.isNull("n")))));
  }

  /**
   * Null checks use the null count.
   */
  @Test
  void nullChecks() {
    Assertions.assertTrue(may(Predicates.isNull("n")));
    Assertions.assertTrue(may(Predicates.isNotNull("n")));
    Assertions.assertFalse(may(Predicates.isNull("s")));
    Assertions.assertFalse(may(Predicates.isNotNull("empty")));
    Assertions.assertFalse(may(Predicates.eq("empty", 1)), "An all-null column never compares TRUE");
  }

  /**
   * Comparisons with NULL literals are never TRUE; NOT IN with a NULL
   * candidate neither.
   */
  @Test
  void nullLiteralsNeverMatch() {
    Assertions.assertFalse(may(Predicates.eq("n", null)));
    Assertions.assertFalse(may(Predicates.notIn("n", 1, null)));
  }

  /**
   * Anything not understood is kept.
   */
  @Test
  void unknownShapesAreConservative() {
    Assertions.assertTrue(may(Predicates.eq("missing", 1)), "Unknown column");
    Assertions.assertTrue(may(new Predicate.Comparison(ComparisonOperator.LT, Predicates.col("n"),
        Predicates.col("n"))), "Column to column");
    Assertions.assertTrue(may(Predicates.eq("day", "not a date")), "Uncoercible literal");
    Assertions.assertTrue(may(null), "No predicate");
  }

  /**
   * AND requires both sides to possibly match, OR either side.
   */
  @Test
  void conjunctionsAndDisjunctions() {
    Assertions.assertFalse(may(Predicates.and(Predicates.gt("n", 5), Predicates.gt("n", 25))));
    Assertions.assertTrue(may(Predicates.or(Predicates.gt("n", 25), Predicates.lt("n", 11))));
  }
}
