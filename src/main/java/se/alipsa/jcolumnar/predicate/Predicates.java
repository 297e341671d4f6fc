package se.alipsa.jcolumnar.predicate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import se.alipsa.jcolumnar.predicate.Operand.ColumnRef;
import se.alipsa.jcolumnar.predicate.Operand.Literal;

/**
 * Static factory helpers for building predicate trees, e.g.
 *
 * <pre>
 * Predicate p = and(between("day", "2024-06-01", "2024-06-30"), gt("value", 10L));
 * </pre>
 */
public final class Predicates {

  private Predicates() {
  }

  public static ColumnRef col(String name) {
    return new ColumnRef(name);
  }

  public static Literal lit(Object value) {
    return new Literal(value);
  }

  public static Predicate eq(String column, Object value) {
    return compare(ComparisonOperator.EQ, column, value);
  }

  public static Predicate ne(String column, Object value) {
    return compare(ComparisonOperator.NE, column, value);
  }

  public static Predicate lt(String column, Object value) {
    return compare(ComparisonOperator.LT, column, value);
  }

  public static Predicate le(String column, Object value) {
    return compare(ComparisonOperator.LE, column, value);
  }

  public static Predicate gt(String column, Object value) {
    return compare(ComparisonOperator.GT, column, value);
  }

  public static Predicate ge(String column, Object value) {
    return compare(ComparisonOperator.GE, column, value);
  }

  /**
   * Compare a column with a literal.
   *
   * @param operator
   *          the operator
   * @param column
   *          the column name
   * @param value
   *          the literal value
   * @return the comparison
   */
  public static Predicate compare(ComparisonOperator operator, String column, Object value) {
    return new Predicate.Comparison(operator, col(column), lit(value));
  }

  public static Predicate between(String column, Object low, Object high) {
    return new Predicate.Between(col(column), lit(low), lit(high), false);
  }

  public static Predicate notBetween(String column, Object low, Object high) {
    return new Predicate.Between(col(column), lit(low), lit(high), true);
  }

  /**
   * {@code column IN (values)}.
   *
   * @param column
   *          the column name
   * @param values
   *          literal values
   * @return the predicate
   */
  public static Predicate in(String column, Object... values) {
    List<Operand> operands = new ArrayList<>(values.length);
    for (Object value : values) {
      operands.add(lit(value));
    }
    return new Predicate.In(col(column), operands, false);
  }

  /**
   * {@code column NOT IN (values)}.
   *
   * @param column
   *          the column name
   * @param values
   *          literal values
   * @return the predicate
   */
  public static Predicate notIn(String column, Object... values) {
    Predicate.In in = (Predicate.In) in(column, values);
    return new Predicate.In(in.operand(), in.values(), true);
  }

  public static Predicate isNull(String column) {
    return new Predicate.IsNull(col(column), false);
  }

  public static Predicate isNotNull(String column) {
    return new Predicate.IsNull(col(column), true);
  }

  /**
   * Left-deep conjunction of all arguments.
   *
   * @param first
   *          first predicate
   * @param rest
   *          remaining predicates
   * @return the conjunction
   */
  public static Predicate and(Predicate first, Predicate... rest) {
    Predicate result = first;
    for (Predicate p : rest) {
      result = new Predicate.And(result, p);
    }
    return result;
  }

  /**
   * Left-deep disjunction of all arguments.
   *
   * @param first
   *          first predicate
   * @param rest
   *          remaining predicates
   * @return the disjunction
   */
  public static Predicate or(Predicate first, Predicate... rest) {
    Predicate result = first;
    for (Predicate p : rest) {
      result = new Predicate.Or(result, p);
    }
    return result;
  }

  public static Predicate not(Predicate predicate) {
    return new Predicate.Not(predicate);
  }

  /**
   * Collect the names of all columns referenced by a predicate.
   *
   * @param predicate
   *          the predicate, may be {@code null}
   * @return referenced column names in encounter order
   */
  public static Set<String> referencedColumns(Predicate predicate) {
    Set<String> columns = new LinkedHashSet<>();
    collect(predicate, columns);
    return columns;
  }

  private static void collect(Predicate predicate, Set<String> out) {
    if (predicate == null) {
      return;
    }
    if (predicate instanceof Predicate.Comparison c) {
      collect(c.left(), out);
      collect(c.right(), out);
    } else if (predicate instanceof Predicate.And a) {
      collect(a.left(), out);
      collect(a.right(), out);
    } else if (predicate instanceof Predicate.Or o) {
      collect(o.left(), out);
      collect(o.right(), out);
    } else if (predicate instanceof Predicate.Not n) {
      collect(n.predicate(), out);
    } else if (predicate instanceof Predicate.Between b) {
      collect(b.operand(), out);
      collect(b.low(), out);
      collect(b.high(), out);
    } else if (predicate instanceof Predicate.In in) {
      collect(in.operand(), out);
      for (Operand value : in.values()) {
        collect(value, out);
      }
    } else if (predicate instanceof Predicate.IsNull n) {
      collect(n.operand(), out);
    }
  }

  private static void collect(Operand operand, Set<String> out) {
    if (operand instanceof ColumnRef ref) {
      out.add(ref.name());
    }
  }
}
