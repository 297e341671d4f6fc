package se.alipsa.jcolumnar.window;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.error.ErrorKind;
import se.alipsa.jcolumnar.error.InvalidFrameSpecException;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.store.DataType;

class FrameSpecTest {

  private static final Map<String, DataType> TYPES = Map.of("ts", DataType.INTEGER, "day", DataType.DATE,
      "price", DataType.DECIMAL, "name", DataType.STRING);

  private static final Function<String, DataType> LOOKUP = TYPES::get;

  private static void check(FrameSpec frame, SortKey... orderBy) {
    frame.validate(List.of(orderBy), LOOKUP, "w");
  }

  @Test
  void acceptsWellFormedFrames() {
    Assertions.assertDoesNotThrow(() -> check(FrameSpec.DEFAULT_ORDERED, SortKey.asc("name")));
    Assertions.assertDoesNotThrow(() -> check(FrameSpec.WHOLE_PARTITION));
    Assertions.assertDoesNotThrow(
        () -> check(FrameSpec.rows(FrameBound.preceding(3), FrameBound.following(1)), SortKey.asc("ts")));
    Assertions.assertDoesNotThrow(
        () -> check(FrameSpec.rows(FrameBound.following(1), FrameBound.following(3)), SortKey.asc("ts")));
    Assertions.assertDoesNotThrow(() -> check(
        FrameSpec.range(FrameBound.preceding(new BigDecimal("2.5")), FrameBound.currentRow()),
        SortKey.asc("price")));
    Assertions.assertDoesNotThrow(
        () -> check(FrameSpec.range(FrameBound.preceding(7), FrameBound.currentRow()), SortKey.desc("day")));
  }

  /**
   * Frames whose start lies after their end are rejected.
   */
  @Test
  void rejectsInvertedBounds() {
    Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(FrameSpec.rows(FrameBound.following(1), FrameBound.preceding(1)), SortKey.asc("ts")));
    Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(FrameSpec.rows(FrameBound.preceding(1), FrameBound.preceding(3)), SortKey.asc("ts")));
    Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(FrameSpec.rows(FrameBound.currentRow(), FrameBound.preceding(1)), SortKey.asc("ts")));
    Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(FrameSpec.rows(FrameBound.unboundedFollowing(), FrameBound.unboundedFollowing())));
    Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(FrameSpec.rows(FrameBound.unboundedPreceding(), FrameBound.unboundedPreceding())));
  }

  @Test
  void rejectsBadOffsets() {
    InvalidFrameSpecException e = Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(FrameSpec.rows(FrameBound.preceding(-1), FrameBound.currentRow()), SortKey.asc("ts")));
    Assertions.assertEquals(ErrorKind.INVALID_FRAME_SPEC, e.kind());
    Assertions.assertEquals("window", e.stage());

    Assertions.assertThrows(InvalidFrameSpecException.class, () -> check(
        FrameSpec.rows(FrameBound.preceding(new BigDecimal("1.5")), FrameBound.currentRow()), SortKey.asc("ts")),
        "ROWS offsets count rows");
    Assertions.assertThrows(InvalidFrameSpecException.class, () -> check(
        FrameSpec.range(FrameBound.preceding(new BigDecimal("0.5")), FrameBound.currentRow()), SortKey.asc("day")),
        "DATE ranges are whole days");
  }

  /**
   * A DATE offset can reach at most from the first to the last date of the
   * calendar.
   */
  @Test
  void dateOffsetIsBoundedByCalendar() {
    Assertions.assertDoesNotThrow(() -> check(
        FrameSpec.range(FrameBound.preceding(700_000_000_000L), FrameBound.currentRow()), SortKey.asc("day")));
    InvalidFrameSpecException e = Assertions.assertThrows(InvalidFrameSpecException.class, () -> check(
        FrameSpec.range(FrameBound.currentRow(), FrameBound.following(Long.MAX_VALUE)), SortKey.asc("day")));
    Assertions.assertEquals(ErrorKind.INVALID_FRAME_SPEC, e.kind());
    Assertions.assertDoesNotThrow(() -> check(
        FrameSpec.range(FrameBound.currentRow(), FrameBound.following(Long.MAX_VALUE)), SortKey.asc("ts")),
        "Numeric keys have no calendar limit");
  }

  @Test
  void rangeOffsetNeedsOneOrderableKey() {
    FrameSpec frame = FrameSpec.range(FrameBound.preceding(1), FrameBound.currentRow());
    Assertions.assertThrows(InvalidFrameSpecException.class, () -> check(frame));
    Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(frame, SortKey.asc("ts"), SortKey.asc("price")));
    InvalidFrameSpecException e = Assertions.assertThrows(InvalidFrameSpecException.class,
        () -> check(frame, SortKey.asc("name")));
    Assertions.assertEquals("name", e.column());
  }

  @Test
  void defaultFrameDependsOnOrdering() {
    Assertions.assertEquals(FrameSpec.WHOLE_PARTITION, WindowSpec.over().effectiveFrame());
    Assertions.assertEquals(FrameSpec.DEFAULT_ORDERED, WindowSpec.orderBy(SortKey.asc("ts")).effectiveFrame());
    Assertions.assertTrue(FrameSpec.WHOLE_PARTITION.isWholePartition());
    Assertions.assertFalse(FrameSpec.DEFAULT_ORDERED.isWholePartition());
  }
}
