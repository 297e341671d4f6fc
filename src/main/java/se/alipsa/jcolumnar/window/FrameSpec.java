package se.alipsa.jcolumnar.window;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import se.alipsa.jcolumnar.error.InvalidFrameSpecException;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.store.DataType;

/**
 * A window frame: unit plus start and end bound.
 *
 * @param unit
 *          ROWS or RANGE
 * @param start
 *          the start bound
 * @param end
 *          the end bound
 */
public record FrameSpec(FrameUnit unit, FrameBound start, FrameBound end) {

  /** {@code RANGE BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW}. */
  public static final FrameSpec DEFAULT_ORDERED =
      new FrameSpec(FrameUnit.RANGE, FrameBound.unboundedPreceding(), FrameBound.currentRow());

  /** {@code ROWS BETWEEN UNBOUNDED PRECEDING AND UNBOUNDED FOLLOWING}. */
  public static final FrameSpec WHOLE_PARTITION =
      new FrameSpec(FrameUnit.ROWS, FrameBound.unboundedPreceding(), FrameBound.unboundedFollowing());

  private static final String STAGE = "window";

  /** Days between the first and the last representable date. */
  private static final BigDecimal MAX_DATE_OFFSET =
      BigDecimal.valueOf(LocalDate.MAX.toEpochDay() - LocalDate.MIN.toEpochDay());

  /**
   * Null checking constructor; consistency is checked by {@link #validate}.
   */
  public FrameSpec {
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  public static FrameSpec rows(FrameBound start, FrameBound end) {
    return new FrameSpec(FrameUnit.ROWS, start, end);
  }

  public static FrameSpec range(FrameBound start, FrameBound end) {
    return new FrameSpec(FrameUnit.RANGE, start, end);
  }

  /**
   * Whether the frame always covers the whole partition.
   *
   * @return {@code true} for UNBOUNDED PRECEDING to UNBOUNDED FOLLOWING
   */
  public boolean isWholePartition() {
    return start.type() == FrameBound.Type.UNBOUNDED_PRECEDING && end.type() == FrameBound.Type.UNBOUNDED_FOLLOWING;
  }

  /**
   * Check the frame before execution.
   *
   * @param orderBy
   *          the ORDER BY keys of the window
   * @param types
   *          column type lookup, returning {@code null} for unknown columns
   * @param column
   *          the column reported in errors, may be {@code null}
   * @throws InvalidFrameSpecException
   *           if the frame is inverted, has a negative or fractional ROWS
   *           offset, uses RANGE offsets without exactly one numeric or date
   *           ORDER BY key, or a DATE offset wider than the calendar
   */
  public void validate(List<SortKey> orderBy, Function<String, DataType> types, String column) {
    if (start.type() == FrameBound.Type.UNBOUNDED_FOLLOWING) {
      throw invalid(column, "Frame cannot start at UNBOUNDED FOLLOWING");
    }
    if (end.type() == FrameBound.Type.UNBOUNDED_PRECEDING) {
      throw invalid(column, "Frame cannot end at UNBOUNDED PRECEDING");
    }
    checkOffset(start, column);
    checkOffset(end, column);
    if (start.type().ordinal() > end.type().ordinal()) {
      throw invalid(column, "Frame start " + start + " is after frame end " + end);
    }
    if (!start.isUnbounded() && !end.isUnbounded()
        && start.signedOffset().compareTo(end.signedOffset()) > 0) {
      throw invalid(column, "Frame start " + start + " is after frame end " + end);
    }
    boolean rangeOffset = unit == FrameUnit.RANGE && (start.offset() != null || end.offset() != null);
    if (rangeOffset) {
      if (orderBy == null || orderBy.size() != 1) {
        throw invalid(column, "RANGE with an offset requires exactly one ORDER BY key");
      }
      DataType keyType = types.apply(orderBy.get(0).column());
      if (keyType == null || !(keyType.isNumeric() || keyType == DataType.DATE)) {
        throw invalid(orderBy.get(0).column(),
            "RANGE with an offset requires a numeric or DATE ORDER BY key but found " + keyType);
      }
      if (keyType == DataType.DATE) {
        checkWhole(start, column);
        checkWhole(end, column);
        checkDateSpan(start, column);
        checkDateSpan(end, column);
      }
    }
    if (unit == FrameUnit.ROWS) {
      checkWhole(start, column);
      checkWhole(end, column);
    }
  }

  private static void checkOffset(FrameBound bound, String column) {
    if (bound.offset() != null && bound.offset().signum() < 0) {
      throw invalid(column, "Frame offset must not be negative: " + bound);
    }
  }

  private static void checkWhole(FrameBound bound, String column) {
    BigDecimal offset = bound.offset();
    if (offset == null) {
      return;
    }
    try {
      offset.longValueExact();
    } catch (ArithmeticException e) {
      throw new InvalidFrameSpecException(STAGE, null, column, "Frame offset must be a whole number: " + bound, e);
    }
  }

  private static void checkDateSpan(FrameBound bound, String column) {
    if (bound.offset() != null && bound.offset().compareTo(MAX_DATE_OFFSET) > 0) {
      throw invalid(column, "DATE frame offset exceeds " + MAX_DATE_OFFSET + " days: " + bound);
    }
  }

  private static InvalidFrameSpecException invalid(String column, String message) {
    return new InvalidFrameSpecException(STAGE, null, column, message);
  }

  @Override
  public String toString() {
    return unit + " BETWEEN " + start + " AND " + end;
  }
}
