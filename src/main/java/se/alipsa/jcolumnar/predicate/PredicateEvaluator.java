package se.alipsa.jcolumnar.predicate;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.predicate.Operand.ColumnRef;
import se.alipsa.jcolumnar.predicate.Operand.Literal;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.Values;

/**
 * Evaluates {@link Predicate} trees against decoded row batches using SQL
 * three-valued logic.
 *
 * <p>
 * A predicate is first bound to a {@link BatchView}: column references are
 * resolved to indexes and literals are coerced to the type of the column they
 * are compared with (ISO date strings against DATE columns, numbers against
 * numeric columns). Binding problems and runtime type conflicts fail the whole
 * evaluation with a {@link PlanException}; rows are never skipped silently.
 * </p>
 */
public final class PredicateEvaluator {

  private final String stage;
  private final String table;

  /**
   * Create an evaluator reporting failures for the given stage.
   *
   * @param stage
   *          stage name used in error reports, e.g. {@code filter} or
   *          {@code having}
   * @param table
   *          table name used in error reports, may be {@code null}
   */
  public PredicateEvaluator(String stage, String table) {
    this.stage = stage;
    this.table = table;
  }

  /**
   * Evaluate a predicate and select the rows for which it is TRUE.
   *
   * @param predicate
   *          the predicate; {@code null} selects every row
   * @param batch
   *          the rows to test
   * @return the selection vector, of the batch length
   */
  public SelectionVector evaluate(Predicate predicate, BatchView batch) {
    int rows = batch.rowCount();
    if (predicate == null) {
      return SelectionVector.all(rows);
    }
    RowTest test = bind(predicate, batch);
    BitSet bits = new BitSet(rows);
    for (int row = 0; row < rows; row++) {
      if (test.test(row).isTrue()) {
        bits.set(row);
      }
    }
    return new SelectionVector(bits, rows);
  }

  /**
   * Evaluate a predicate and return the three-valued result of every row.
   *
   * @param predicate
   *          the predicate
   * @param batch
   *          the rows to test
   * @return one result per row
   */
  public TriState[] evaluateTriState(Predicate predicate, BatchView batch) {
    RowTest test = bind(predicate, batch);
    TriState[] results = new TriState[batch.rowCount()];
    for (int row = 0; row < results.length; row++) {
      results[row] = test.test(row);
    }
    return results;
  }

  /**
   * Bind a predicate to a batch for repeated per-row evaluation.
   *
   * @param predicate
   *          the predicate
   * @param batch
   *          the batch the row indexes refer to
   * @return the bound test
   */
  public RowTest bind(Predicate predicate, BatchView batch) {
    if (predicate instanceof Predicate.And and) {
      RowTest left = bind(and.left(), batch);
      RowTest right = bind(and.right(), batch);
      return row -> {
        TriState l = left.test(row);
        return l == TriState.FALSE ? TriState.FALSE : l.and(right.test(row));
      };
    }
    if (predicate instanceof Predicate.Or or) {
      RowTest left = bind(or.left(), batch);
      RowTest right = bind(or.right(), batch);
      return row -> {
        TriState l = left.test(row);
        return l == TriState.TRUE ? TriState.TRUE : l.or(right.test(row));
      };
    }
    if (predicate instanceof Predicate.Not not) {
      RowTest inner = bind(not.predicate(), batch);
      return row -> inner.test(row).not();
    }
    if (predicate instanceof Predicate.Comparison cmp) {
      return bindComparison(cmp, batch);
    }
    if (predicate instanceof Predicate.Between between) {
      return bindBetween(between, batch);
    }
    if (predicate instanceof Predicate.In in) {
      return bindIn(in, batch);
    }
    if (predicate instanceof Predicate.IsNull isNull) {
      ValueAccessor operand = operand(isNull.operand(), batch, null);
      boolean negated = isNull.negated();
      return row -> TriState.of((operand.get(row) == null) != negated);
    }
    throw new PlanException(stage, table, null, "Unsupported predicate: " + predicate);
  }

  private RowTest bindComparison(Predicate.Comparison cmp, BatchView batch) {
    DataType leftType = typeOf(cmp.left(), batch);
    DataType rightType = typeOf(cmp.right(), batch);
    checkCompatible(cmp.left(), leftType, cmp.right(), rightType, cmp);
    ValueAccessor left = operand(cmp.left(), batch, rightType);
    ValueAccessor right = operand(cmp.right(), batch, leftType);
    ComparisonOperator op = cmp.operator();
    return row -> {
      Object l = left.get(row);
      Object r = right.get(row);
      if (l == null || r == null) {
        return TriState.UNKNOWN;
      }
      return TriState.of(op.test(compare(l, r, cmp)));
    };
  }

  private RowTest bindBetween(Predicate.Between between, BatchView batch) {
    DataType type = typeOf(between.operand(), batch);
    checkCompatible(between.operand(), type, between.low(), typeOf(between.low(), batch), between);
    checkCompatible(between.operand(), type, between.high(), typeOf(between.high(), batch), between);
    ValueAccessor value = operand(between.operand(), batch, null);
    ValueAccessor low = operand(between.low(), batch, type);
    ValueAccessor high = operand(between.high(), batch, type);
    boolean negated = between.negated();
    return row -> {
      Object v = value.get(row);
      TriState geLow = bounded(v, low.get(row), true, between);
      TriState leHigh = bounded(v, high.get(row), false, between);
      TriState result = geLow.and(leHigh);
      return negated ? result.not() : result;
    };
  }

  private TriState bounded(Object value, Object bound, boolean lower, Predicate source) {
    if (value == null || bound == null) {
      return TriState.UNKNOWN;
    }
    int cmp = compare(value, bound, source);
    return TriState.of(lower ? cmp >= 0 : cmp <= 0);
  }

  private RowTest bindIn(Predicate.In in, BatchView batch) {
    DataType type = typeOf(in.operand(), batch);
    ValueAccessor value = operand(in.operand(), batch, null);
    List<ValueAccessor> candidates = new ArrayList<>(in.values().size());
    for (Operand candidate : in.values()) {
      checkCompatible(in.operand(), type, candidate, typeOf(candidate, batch), in);
      candidates.add(operand(candidate, batch, type));
    }
    boolean negated = in.negated();
    return row -> {
      Object v = value.get(row);
      TriState result;
      if (v == null) {
        result = TriState.UNKNOWN;
      } else {
        result = TriState.FALSE;
        for (ValueAccessor candidate : candidates) {
          Object c = candidate.get(row);
          if (c == null) {
            result = TriState.UNKNOWN;
          } else if (compare(v, c, in) == 0) {
            result = TriState.TRUE;
            break;
          }
        }
      }
      return negated ? result.not() : result;
    };
  }

  private int compare(Object left, Object right, Predicate source) {
    try {
      return Values.compare(left, right);
    } catch (IllegalArgumentException e) {
      throw new PlanException(stage, table, null, "Type conflict evaluating " + source + ": " + e.getMessage(), e);
    }
  }

  private void checkCompatible(Operand left, DataType leftType, Operand right, DataType rightType,
      Predicate source) {
    if (leftType == null || rightType == null) {
      return;
    }
    if (left instanceof ColumnRef && right instanceof ColumnRef) {
      boolean ok = leftType == rightType || (leftType.isNumeric() && rightType.isNumeric());
      if (!ok) {
        throw new PlanException(stage, table, ((ColumnRef) left).name(),
            "Cannot compare " + leftType + " with " + rightType + " in " + source);
      }
    }
  }

  private DataType typeOf(Operand operand, BatchView batch) {
    if (operand instanceof ColumnRef ref) {
      return batch.columnType(resolve(ref, batch));
    }
    return null;
  }

  private int resolve(ColumnRef ref, BatchView batch) {
    int idx = batch.columnIndex(ref.name());
    if (idx < 0) {
      throw new PlanException(stage, table, ref.name(), "Unknown column in predicate");
    }
    return idx;
  }

  private ValueAccessor operand(Operand operand, BatchView batch, DataType peerType) {
    if (operand instanceof ColumnRef ref) {
      int idx = resolve(ref, batch);
      return row -> batch.value(idx, row);
    }
    if (operand instanceof Literal literal) {
      Object value;
      try {
        value = Values.coerce(literal.value(), peerType);
      } catch (IllegalArgumentException e) {
        throw new PlanException(stage, table, null, e.getMessage(), e);
      }
      return row -> value;
    }
    throw new PlanException(stage, table, null, "Unsupported operand: " + operand);
  }

  /**
   * A predicate bound to one batch.
   */
  @FunctionalInterface
  public interface RowTest {

    /**
     * Evaluate the predicate for one row.
     *
     * @param row
     *          the row index in the bound batch
     * @return the three-valued result
     */
    TriState test(int row);
  }

  @FunctionalInterface
  private interface ValueAccessor {
    Object get(int row);
  }
}
