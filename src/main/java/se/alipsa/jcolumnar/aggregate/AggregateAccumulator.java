package se.alipsa.jcolumnar.aggregate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashSet;
import java.util.Set;
import se.alipsa.jcolumnar.error.AggregateOverflowException;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.Values;

/**
 * Running state of one aggregate. Accumulators for SUM, COUNT and AVG are
 * reversible ({@link #remove(Object)}) so sliding window frames can retract
 * rows leaving the frame. MIN and MAX are not; window frames use a monotonic
 * deque for those instead. {@code COUNT(DISTINCT)} keeps the set of values
 * seen and is not reversible either.
 */
public abstract class AggregateAccumulator {

  /** Decimal SUM results wider than this many digits overflow. */
  public static final int MAX_DECIMAL_PRECISION = 38;

  final String stage;
  final String column;

  AggregateAccumulator(String stage, String column) {
    this.stage = stage;
    this.column = column;
  }

  /**
   * Create an accumulator.
   *
   * @param function
   *          the aggregate function
   * @param input
   *          the argument type, {@code null} for {@code COUNT(*)}
   * @param countStar
   *          {@code true} to count every row including nulls
   * @param stage
   *          stage reported by overflow errors
   * @param column
   *          column reported by overflow errors
   * @return a fresh accumulator
   */
  public static AggregateAccumulator create(AggregateFunction function, DataType input, boolean countStar,
      String stage, String column) {
    return create(function, input, countStar, false, stage, column);
  }

  /**
   * Create an accumulator, optionally counting distinct values.
   *
   * @param function
   *          the aggregate function
   * @param input
   *          the argument type, {@code null} for {@code COUNT(*)}
   * @param countStar
   *          {@code true} to count every row including nulls
   * @param distinct
   *          {@code true} for {@code COUNT(DISTINCT column)}
   * @param stage
   *          stage reported by overflow errors
   * @param column
   *          column reported by overflow errors
   * @return a fresh accumulator
   */
  public static AggregateAccumulator create(AggregateFunction function, DataType input, boolean countStar,
      boolean distinct, String stage, String column) {
    if (distinct) {
      if (function != AggregateFunction.COUNT || countStar) {
        throw new IllegalArgumentException("DISTINCT is only supported as COUNT(DISTINCT column)");
      }
      return new DistinctCountAccumulator(stage, column);
    }
    return switch (function) {
      case COUNT -> new CountAccumulator(stage, column, countStar);
      case SUM -> new SumAccumulator(stage, column, input);
      case AVG -> new AvgAccumulator(stage, column);
      case MIN -> new ExtremumAccumulator(stage, column, false);
      case MAX -> new ExtremumAccumulator(stage, column, true);
    };
  }

  /**
   * Fold a value into the state. Nulls are ignored except by
   * {@code COUNT(*)}.
   *
   * @param value
   *          the value, may be {@code null}
   */
  public abstract void add(Object value);

  /**
   * Retract a value previously added.
   *
   * @param value
   *          the value, may be {@code null}
   * @throws UnsupportedOperationException
   *           if the aggregate is not reversible
   */
  public void remove(Object value) {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support removal");
  }

  /**
   * Whether {@link #remove(Object)} is supported.
   *
   * @return {@code true} for reversible aggregates
   */
  public boolean isReversible() {
    return false;
  }

  /**
   * Combine the state of another accumulator of the same kind into this one.
   *
   * @param other
   *          the partial state to absorb
   */
  public abstract void merge(AggregateAccumulator other);

  /** Return to the empty state. */
  public abstract void reset();

  /**
   * The finalized value.
   *
   * @return the aggregate result; {@code null} for an empty SUM, AVG, MIN or
   *         MAX
   */
  public abstract Object result();

  AggregateOverflowException overflow(String detail, ArithmeticException cause) {
    return new AggregateOverflowException(stage, null, column, detail, cause);
  }

  static final class CountAccumulator extends AggregateAccumulator {
    private final boolean countStar;
    private long count;

    CountAccumulator(String stage, String column, boolean countStar) {
      super(stage, column);
      this.countStar = countStar;
    }

    @Override
    public void add(Object value) {
      if (countStar || value != null) {
        try {
          count = Math.incrementExact(count);
        } catch (ArithmeticException e) {
          throw overflow("COUNT exceeds " + Long.MAX_VALUE, e);
        }
      }
    }

    @Override
    public void remove(Object value) {
      if (countStar || value != null) {
        count--;
      }
    }

    @Override
    public boolean isReversible() {
      return true;
    }

    @Override
    public void merge(AggregateAccumulator other) {
      try {
        count = Math.addExact(count, ((CountAccumulator) other).count);
      } catch (ArithmeticException e) {
        throw overflow("COUNT exceeds " + Long.MAX_VALUE, e);
      }
    }

    @Override
    public void reset() {
      count = 0L;
    }

    @Override
    public Object result() {
      return count;
    }
  }

  static final class DistinctCountAccumulator extends AggregateAccumulator {
    private final Set<Object> seen = new HashSet<>();

    DistinctCountAccumulator(String stage, String column) {
      super(stage, column);
    }

    @Override
    public void add(Object value) {
      if (value != null) {
        seen.add(value);
      }
    }

    @Override
    public void merge(AggregateAccumulator other) {
      seen.addAll(((DistinctCountAccumulator) other).seen);
    }

    @Override
    public void reset() {
      seen.clear();
    }

    @Override
    public Object result() {
      return (long) seen.size();
    }
  }

  /**
   * SUM keeps an exact long for INTEGER input, a BigDecimal for DECIMAL input
   * and a BigDecimal of the decimal representation for DOUBLE input, so that
   * removal restores the previous state exactly.
   */
  static final class SumAccumulator extends AggregateAccumulator {
    private final DataType input;
    private long longSum;
    private BigDecimal decimalSum = BigDecimal.ZERO;
    private long count;

    SumAccumulator(String stage, String column, DataType input) {
      super(stage, column);
      this.input = input;
    }

    @Override
    public void add(Object value) {
      if (value == null) {
        return;
      }
      if (input == DataType.INTEGER) {
        try {
          longSum = Math.addExact(longSum, ((Number) value).longValue());
        } catch (ArithmeticException e) {
          throw overflow("SUM exceeds the INTEGER range", e);
        }
      } else {
        decimalSum = checkPrecision(decimalSum.add(Values.toBigDecimal(value)));
      }
      count++;
    }

    @Override
    public void remove(Object value) {
      if (value == null) {
        return;
      }
      if (input == DataType.INTEGER) {
        try {
          longSum = Math.subtractExact(longSum, ((Number) value).longValue());
        } catch (ArithmeticException e) {
          throw overflow("SUM exceeds the INTEGER range", e);
        }
      } else {
        decimalSum = decimalSum.subtract(Values.toBigDecimal(value));
      }
      count--;
    }

    @Override
    public boolean isReversible() {
      return true;
    }

    @Override
    public void merge(AggregateAccumulator other) {
      SumAccumulator o = (SumAccumulator) other;
      if (input == DataType.INTEGER) {
        try {
          longSum = Math.addExact(longSum, o.longSum);
        } catch (ArithmeticException e) {
          throw overflow("SUM exceeds the INTEGER range", e);
        }
      } else {
        decimalSum = checkPrecision(decimalSum.add(o.decimalSum));
      }
      count += o.count;
    }

    private BigDecimal checkPrecision(BigDecimal sum) {
      if (input == DataType.DECIMAL && sum.precision() > MAX_DECIMAL_PRECISION) {
        throw overflow("SUM exceeds " + MAX_DECIMAL_PRECISION + " digits of precision", null);
      }
      return sum;
    }

    @Override
    public void reset() {
      longSum = 0L;
      decimalSum = BigDecimal.ZERO;
      count = 0L;
    }

    @Override
    public Object result() {
      if (count == 0L) {
        return null;
      }
      if (input == DataType.INTEGER) {
        return longSum;
      }
      if (input == DataType.DOUBLE) {
        return decimalSum.doubleValue();
      }
      return decimalSum;
    }
  }

  static final class AvgAccumulator extends AggregateAccumulator {
    private BigDecimal sum = BigDecimal.ZERO;
    private long count;

    AvgAccumulator(String stage, String column) {
      super(stage, column);
    }

    @Override
    public void add(Object value) {
      if (value == null) {
        return;
      }
      sum = sum.add(Values.toBigDecimal(value));
      count++;
    }

    @Override
    public void remove(Object value) {
      if (value == null) {
        return;
      }
      sum = sum.subtract(Values.toBigDecimal(value));
      count--;
    }

    @Override
    public boolean isReversible() {
      return true;
    }

    @Override
    public void merge(AggregateAccumulator other) {
      AvgAccumulator o = (AvgAccumulator) other;
      sum = sum.add(o.sum);
      count += o.count;
    }

    @Override
    public void reset() {
      sum = BigDecimal.ZERO;
      count = 0L;
    }

    @Override
    public Object result() {
      if (count == 0L) {
        return null;
      }
      return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64).doubleValue();
    }
  }

  static final class ExtremumAccumulator extends AggregateAccumulator {
    private final boolean isMax;
    private Object extremum;

    ExtremumAccumulator(String stage, String column, boolean isMax) {
      super(stage, column);
      this.isMax = isMax;
    }

    @Override
    public void add(Object value) {
      if (value == null) {
        return;
      }
      if (extremum == null) {
        extremum = value;
        return;
      }
      int cmp = Values.compare(value, extremum);
      if ((isMax && cmp > 0) || (!isMax && cmp < 0)) {
        extremum = value;
      }
    }

    @Override
    public void merge(AggregateAccumulator other) {
      add(((ExtremumAccumulator) other).extremum);
    }

    @Override
    public void reset() {
      extremum = null;
    }

    @Override
    public Object result() {
      return extremum;
    }
  }
}
