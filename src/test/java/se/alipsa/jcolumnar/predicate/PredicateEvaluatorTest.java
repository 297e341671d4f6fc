package se.alipsa.jcolumnar.predicate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.exec.RowSet;
import se.alipsa.jcolumnar.plan.ResultColumn;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Tests for row level predicate evaluation with three-valued logic.
 */
class PredicateEvaluatorTest {

  private final PredicateEvaluator evaluator = new PredicateEvaluator("filter", "t");

  private static RowSet rows() {
    List<Object[]> rows = new ArrayList<>();
    rows.add(new Object[] {1L, "a", LocalDate.of(2024, 6, 1), 1.5});
    rows.add(new Object[] {2L, null, LocalDate.of(2024, 6, 15), null});
    rows.add(new Object[] {null, "c", null, 3.0});
    rows.add(new Object[] {4L, "d", LocalDate.of(2024, 7, 1), 4.5});
    return new RowSet(List.of(new ResultColumn("n", DataType.INTEGER), new ResultColumn("s", DataType.STRING),
        new ResultColumn("day", DataType.DATE), new ResultColumn("x", DataType.DOUBLE)), rows);
  }

  private int[] select(Predicate predicate) {
    return evaluator.evaluate(predicate, rows()).indices();
  }

  /**
   * A comparison with a NULL operand is UNKNOWN and never selects the row.
   */
  @Test
  void comparisonsWithNullAreUnknown() {
    Assertions.assertArrayEquals(new int[] {1, 3}, select(Predicates.gt("n", 1)));
    Assertions.assertArrayEquals(new int[] {0}, select(Predicates.le("n", 1)));
    TriState[] states = evaluator.evaluateTriState(Predicates.gt("n", 1), rows());
    Assertions.assertEquals(TriState.UNKNOWN, states[2], "NULL > 1 is UNKNOWN");
  }

  /**
   * NOT of UNKNOWN stays UNKNOWN, so neither a predicate nor its negation
   * selects a NULL row.
   */
  @Test
  void negationKeepsUnknown() {
    Assertions.assertArrayEquals(new int[] {0}, select(Predicates.not(Predicates.gt("n", 1))));
  }

  /**
   * FALSE AND UNKNOWN is FALSE while TRUE OR UNKNOWN is TRUE.
   */
  @Test
  void andOrFollowThreeValuedLogic() {
    TriState[] and = evaluator.evaluateTriState(Predicates.and(Predicates.eq("s", "zzz"), Predicates.gt("n", 0)),
        rows());
    Assertions.assertEquals(TriState.FALSE, and[2], "FALSE AND UNKNOWN");
    TriState[] or = evaluator.evaluateTriState(Predicates.or(Predicates.eq("s", "c"), Predicates.gt("n", 0)),
        rows());
    Assertions.assertEquals(TriState.TRUE, or[2], "TRUE OR UNKNOWN");
    Assertions.assertEquals(TriState.TRUE, or[1], "UNKNOWN OR TRUE");
  }

  /**
   * Date literals given as ISO strings are coerced to the column type.
   */
  @Test
  void betweenCoercesDateLiterals() {
    Assertions.assertArrayEquals(new int[] {0, 1}, select(Predicates.between("day", "2024-06-01", "2024-06-30")));
    Assertions.assertArrayEquals(new int[] {3}, select(Predicates.notBetween("day", "2024-06-01", "2024-06-30")));
  }

  /**
   * IN is UNKNOWN for a NULL operand, and NOT IN with a NULL candidate never
   * selects a row.
   */
  @Test
  void inListSemantics() {
    Assertions.assertArrayEquals(new int[] {0, 3}, select(Predicates.in("n", 1, 4, 9)));
    Assertions.assertArrayEquals(new int[] {1}, select(Predicates.notIn("n", 1, 4)));
    Assertions.assertArrayEquals(new int[0], select(Predicates.notIn("n", 1, null)));
  }

  /**
   * IS NULL and IS NOT NULL are always TRUE or FALSE.
   */
  @Test
  void isNullIsTwoValued() {
    Assertions.assertArrayEquals(new int[] {1}, select(Predicates.isNull("s")));
    Assertions.assertArrayEquals(new int[] {0, 2, 3}, select(Predicates.isNotNull("s")));
  }

  /**
   * Integer literals compare with double columns numerically.
   */
  @Test
  void mixedNumericComparison() {
    Assertions.assertArrayEquals(new int[] {2, 3}, select(Predicates.ge("x", 3)));
  }

  /**
   * Column to column comparison.
   */
  @Test
  void columnComparison() {
    Predicate predicate = new Predicate.Comparison(ComparisonOperator.LT, Predicates.col("n"), Predicates.col("x"));
    Assertions.assertArrayEquals(new int[] {0, 3}, select(predicate));
  }

  /**
   * A null predicate selects every row.
   */
  @Test
  void nullPredicateSelectsAll() {
    Assertions.assertEquals(4, evaluator.evaluate(null, rows()).count());
  }

  /**
   * Unknown columns and incompatible literals fail with a plan error.
   */
  @Test
  void invalidReferencesFail() {
    PlanException unknown = Assertions.assertThrows(PlanException.class, () -> select(Predicates.eq("nope", 1)));
    Assertions.assertEquals("nope", unknown.column());
    Assertions.assertEquals("filter", unknown.stage());
    Assertions.assertThrows(PlanException.class, () -> select(Predicates.eq("day", "not a date")));
  }

  /**
   * The three-valued truth tables.
   */
  @Test
  void truthTables() {
    List<TriState> values = Arrays.asList(TriState.TRUE, TriState.FALSE, TriState.UNKNOWN);
    for (TriState value : values) {
      Assertions.assertEquals(TriState.FALSE, TriState.FALSE.and(value), "FALSE AND " + value);
      Assertions.assertEquals(TriState.TRUE, TriState.TRUE.or(value), "TRUE OR " + value);
    }
    Assertions.assertEquals(TriState.UNKNOWN, TriState.UNKNOWN.and(TriState.TRUE));
    Assertions.assertEquals(TriState.UNKNOWN, TriState.UNKNOWN.or(TriState.FALSE));
    Assertions.assertEquals(TriState.UNKNOWN, TriState.UNKNOWN.not());
  }
}
