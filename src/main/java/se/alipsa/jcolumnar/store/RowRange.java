package se.alipsa.jcolumnar.store;

/**
 * Half-open range of row ordinals {@code [start, end)}.
 *
 * @param start
 *          first row ordinal (inclusive)
 * @param end
 *          last row ordinal (exclusive)
 */
public record RowRange(long start, long end) {

  /**
   * Validating constructor.
   */
  public RowRange {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid row range [" + start + ", " + end + ")");
    }
  }

  /**
   * Create a range from a start ordinal and a length.
   *
   * @param start
   *          first row ordinal
   * @param length
   *          number of rows
   * @return the range
   */
  public static RowRange of(long start, long length) {
    return new RowRange(start, start + length);
  }

  /**
   * Number of rows covered.
   *
   * @return the row count
   */
  public long length() {
    return end - start;
  }

  /**
   * Whether the range contains no rows.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return start == end;
  }

  /**
   * Whether this range shares at least one row with another.
   *
   * @param other
   *          the other range
   * @return {@code true} when the ranges overlap
   */
  public boolean overlaps(RowRange other) {
    return start < other.end && other.start < end;
  }

  /**
   * Intersection of this range with another.
   *
   * @param other
   *          the other range
   * @return the overlapping part, empty when the ranges are disjoint
   */
  public RowRange intersect(RowRange other) {
    long s = Math.max(start, other.start);
    long e = Math.min(end, other.end);
    return e <= s ? new RowRange(s, s) : new RowRange(s, e);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
