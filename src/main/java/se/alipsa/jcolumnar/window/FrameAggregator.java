package se.alipsa.jcolumnar.window;

import se.alipsa.jcolumnar.aggregate.AggregateAccumulator;
import se.alipsa.jcolumnar.aggregate.AggregateFunction;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Evaluates frame based functions (aggregates, FIRST_VALUE, LAST_VALUE) for
 * one partition.
 *
 * <p>
 * Because frame bounds never move backwards, every function is computed in a
 * single forward sweep: rows are added when the frame end passes them and
 * removed when the frame start passes them. SUM, AVG and COUNT retract rows
 * through their reversible accumulators, MIN and MAX through a
 * {@link MonotonicDeque}. A cumulative frame therefore costs O(1) amortized
 * per row and a sliding frame never rescans its width. Frames spanning the
 * whole partition are computed once.
 * </p>
 */
final class FrameAggregator {

  private FrameAggregator() {
  }

  /**
   * Compute the call for every position of the partition.
   *
   * @param call
   *          the frame function
   * @param partition
   *          the sorted partition
   * @param frame
   *          the frame in effect
   * @param argument
   *          argument values indexed by input row, {@code null} for COUNT(*)
   * @param argumentType
   *          the argument type
   * @param out
   *          results indexed by input row
   */
  static void evaluate(WindowFunctionCall call, WindowPartition partition, FrameSpec frame, Object[] argument,
      DataType argumentType, Object[] out) {
    int n = partition.size();
    if (n == 0) {
      return;
    }
    WindowFunctionType type = call.function();
    if (type == WindowFunctionType.FIRST_VALUE || type == WindowFunctionType.LAST_VALUE) {
      FrameBounds bounds = FrameBounds.compute(partition, frame);
      boolean first = type == WindowFunctionType.FIRST_VALUE;
      for (int i = 0; i < n; i++) {
        int lo = bounds.lo(i);
        int hi = bounds.hi(i);
        out[partition.row(i)] = lo >= hi ? null : argument[partition.row(first ? lo : hi - 1)];
      }
      return;
    }
    AggregateFunction function = type.aggregateFunction();
    boolean countStar = call.argument() == null;
    AggregateAccumulator accumulator =
        AggregateAccumulator.create(function, argumentType, countStar, "window", call.argument());
    if (frame.isWholePartition()) {
      for (int i = 0; i < n; i++) {
        accumulator.add(value(argument, partition, i));
      }
      Object result = accumulator.result();
      for (int i = 0; i < n; i++) {
        out[partition.row(i)] = result;
      }
      return;
    }
    FrameBounds bounds = FrameBounds.compute(partition, frame);
    if (function == AggregateFunction.MIN || function == AggregateFunction.MAX) {
      slideExtreme(partition, bounds, argument, function == AggregateFunction.MAX, out);
    } else {
      slideReversible(partition, bounds, argument, accumulator, out);
    }
  }

  private static void slideReversible(WindowPartition partition, FrameBounds bounds, Object[] argument,
      AggregateAccumulator accumulator, Object[] out) {
    int curLo = 0;
    int curHi = 0;
    for (int i = 0; i < partition.size(); i++) {
      int lo = bounds.lo(i);
      int hi = bounds.hi(i);
      if (lo >= curHi) {
        // disjoint from the previous frame, start over
        accumulator.reset();
        curLo = lo;
        curHi = lo;
      }
      // leaving rows go first so the running state never covers more than a frame
      while (curLo < lo) {
        accumulator.remove(value(argument, partition, curLo++));
      }
      while (curHi < hi) {
        accumulator.add(value(argument, partition, curHi++));
      }
      out[partition.row(i)] = accumulator.result();
    }
  }

  private static void slideExtreme(WindowPartition partition, FrameBounds bounds, Object[] argument, boolean max,
      Object[] out) {
    MonotonicDeque deque = new MonotonicDeque(partition.size(), max);
    int curHi = 0;
    for (int i = 0; i < partition.size(); i++) {
      int lo = bounds.lo(i);
      int hi = bounds.hi(i);
      if (lo >= curHi) {
        deque.clear();
        curHi = lo;
      }
      while (curHi < hi) {
        deque.push(curHi, value(argument, partition, curHi));
        curHi++;
      }
      deque.evictBefore(lo);
      out[partition.row(i)] = deque.extreme();
    }
  }

  private static Object value(Object[] argument, WindowPartition partition, int position) {
    return argument == null ? null : argument[partition.row(position)];
  }
}
