package se.alipsa.jcolumnar.window;

import java.math.BigDecimal;
import java.time.LocalDate;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.store.Values;

/**
 * Frame of every position of a partition as half open position ranges
 * {@code [lo, hi)}. For a validated frame both {@code lo} and {@code hi} are
 * non-decreasing in position order, which the incremental aggregators rely
 * on.
 */
final class FrameBounds {

  private final int[] lo;
  private final int[] hi;

  private FrameBounds(int[] lo, int[] hi) {
    this.lo = lo;
    this.hi = hi;
  }

  int lo(int position) {
    return lo[position];
  }

  int hi(int position) {
    return hi[position];
  }

  static FrameBounds compute(WindowPartition partition, FrameSpec frame) {
    int n = partition.size();
    int[] lo = new int[n];
    int[] hi = new int[n];
    RangeSearch search = frame.unit() == FrameUnit.RANGE ? new RangeSearch(partition) : null;
    for (int i = 0; i < n; i++) {
      int start;
      int end;
      if (search == null) {
        start = rowsBound(frame.start(), i, n, true);
        end = rowsBound(frame.end(), i, n, false);
      } else {
        start = search.bound(frame.start(), i, true);
        end = search.bound(frame.end(), i, false);
      }
      lo[i] = start;
      hi[i] = Math.max(start, end);
    }
    return new FrameBounds(lo, hi);
  }

  private static int rowsBound(FrameBound bound, int position, int size, boolean start) {
    long target = switch (bound.type()) {
      case UNBOUNDED_PRECEDING -> 0L;
      case UNBOUNDED_FOLLOWING -> size;
      case CURRENT_ROW -> start ? position : position + 1L;
      case PRECEDING -> position - clampedOffset(bound, size) + (start ? 0L : 1L);
      case FOLLOWING -> position + clampedOffset(bound, size) + (start ? 0L : 1L);
    };
    return (int) Math.max(0L, Math.min(size, target));
  }

  /**
   * Any offset beyond the partition size reaches past its edge, so cap it
   * there to keep the position arithmetic inside {@code long}.
   */
  private static long clampedOffset(FrameBound bound, int size) {
    BigDecimal cap = BigDecimal.valueOf(size + 1L);
    return bound.offset().compareTo(cap) > 0 ? cap.longValue() : bound.offset().longValue();
  }

  /**
   * Resolves RANGE bounds over the single ORDER BY key by binary search in the
   * non-null run of the partition.
   */
  private static final class RangeSearch {
    private static final Object BELOW_ALL = new Object();
    private static final Object ABOVE_ALL = new Object();
    private static final BigDecimal MIN_EPOCH_DAY = BigDecimal.valueOf(LocalDate.MIN.toEpochDay());
    private static final BigDecimal MAX_EPOCH_DAY = BigDecimal.valueOf(LocalDate.MAX.toEpochDay());

    private final WindowPartition partition;
    private final SortKey key;
    private final int nonNullStart;
    private final int nonNullEnd;

    RangeSearch(WindowPartition partition) {
      this.partition = partition;
      this.key = partition.orderBy().isEmpty() ? null : partition.orderBy().get(0);
      int n = partition.size();
      int first = 0;
      int last = n;
      if (key != null) {
        while (first < n && partition.orderValue(first, 0) == null) {
          first++;
        }
        while (last > first && partition.orderValue(last - 1, 0) == null) {
          last--;
        }
      }
      this.nonNullStart = first;
      this.nonNullEnd = last;
    }

    int bound(FrameBound bound, int position, boolean start) {
      switch (bound.type()) {
        case UNBOUNDED_PRECEDING:
          return 0;
        case UNBOUNDED_FOLLOWING:
          return partition.size();
        case CURRENT_ROW:
          return start ? partition.peerStart(position) : partition.peerEnd(position);
        default:
          break;
      }
      Object value = partition.orderValue(position, 0);
      if (value == null) {
        // null keys have no distance to anything but other nulls
        return start ? partition.peerStart(position) : partition.peerEnd(position);
      }
      BigDecimal offset = bound.signedOffset();
      Object target = shift(value, key.ascending() ? offset : offset.negate());
      if (target == BELOW_ALL || target == ABOVE_ALL) {
        return (target == BELOW_ALL) == key.ascending() ? nonNullStart : nonNullEnd;
      }
      int low = nonNullStart;
      int high = nonNullEnd;
      while (low < high) {
        int mid = (low + high) >>> 1;
        int cmp = key.compare(partition.orderValue(mid, 0), target);
        boolean before = start ? cmp < 0 : cmp <= 0;
        if (before) {
          low = mid + 1;
        } else {
          high = mid;
        }
      }
      return low;
    }

    /**
     * The key value at {@code delta} from {@code value}. A date shifted past
     * the supported calendar range lies below or above every stored date.
     */
    private static Object shift(Object value, BigDecimal delta) {
      if (value instanceof LocalDate date) {
        BigDecimal epochDay = BigDecimal.valueOf(date.toEpochDay()).add(delta);
        if (epochDay.compareTo(MIN_EPOCH_DAY) < 0) {
          return BELOW_ALL;
        }
        if (epochDay.compareTo(MAX_EPOCH_DAY) > 0) {
          return ABOVE_ALL;
        }
        return LocalDate.ofEpochDay(epochDay.longValueExact());
      }
      return Values.toBigDecimal(value).add(delta);
    }
  }
}
