package se.alipsa.jcolumnar.window;

import se.alipsa.jcolumnar.store.Values;

/**
 * Sliding MIN or MAX over a frame whose bounds only move forward. Positions are
 * kept in a deque whose values are monotonic, so the extreme value is always
 * at the head and every position is pushed and popped at most once.
 */
final class MonotonicDeque {

  private final boolean max;
  private final int[] positions;
  private final Object[] values;
  private int head;
  private int tail;

  MonotonicDeque(int capacity, boolean max) {
    this.max = max;
    this.positions = new int[capacity];
    this.values = new Object[capacity];
  }

  /**
   * Add the value entering the frame. Nulls are ignored.
   */
  void push(int position, Object value) {
    if (value == null) {
      return;
    }
    while (tail > head && dominated(values[tail - 1], value)) {
      tail--;
    }
    positions[tail] = position;
    values[tail] = value;
    tail++;
  }

  /**
   * Drop positions that left the frame.
   */
  void evictBefore(int lo) {
    while (tail > head && positions[head] < lo) {
      head++;
    }
  }

  Object extreme() {
    return tail > head ? values[head] : null;
  }

  void clear() {
    head = 0;
    tail = 0;
  }

  private boolean dominated(Object existing, Object incoming) {
    int cmp = Values.compare(existing, incoming);
    return max ? cmp <= 0 : cmp >= 0;
  }
}
