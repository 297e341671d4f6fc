package se.alipsa.jcolumnar.store.codec;

import java.time.LocalDate;
import java.util.List;

/**
 * Integer and date column slice stored as the difference between each value
 * and the slice minimum, cast to the narrowest unsigned width (1, 2, 4 or 8
 * bytes) that holds the value range. Dates are handled through their epoch day.
 */
final class DeltaColumn implements EncodedColumn {

  private final boolean dates;
  private final long base;
  private final int width;
  private final byte[] bytes;
  private final short[] shorts;
  private final int[] ints;
  private final long[] longs;
  private final boolean[] nulls;
  private final int size;

  private DeltaColumn(boolean dates, long base, long range, long[] raw, boolean[] nulls) {
    this.dates = dates;
    this.base = base;
    this.size = raw.length;
    this.nulls = nulls;
    this.width = widthFor(range);
    byte[] b = null;
    short[] s = null;
    int[] i4 = null;
    long[] l8 = null;
    switch (width) {
      case 1 -> {
        b = new byte[size];
        for (int i = 0; i < size; i++) {
          b[i] = (byte) (raw[i] - base);
        }
      }
      case 2 -> {
        s = new short[size];
        for (int i = 0; i < size; i++) {
          s[i] = (short) (raw[i] - base);
        }
      }
      case 4 -> {
        i4 = new int[size];
        for (int i = 0; i < size; i++) {
          i4[i] = (int) (raw[i] - base);
        }
      }
      default -> {
        l8 = new long[size];
        for (int i = 0; i < size; i++) {
          l8[i] = raw[i] - base;
        }
      }
    }
    this.bytes = b;
    this.shorts = s;
    this.ints = i4;
    this.longs = l8;
  }

  /**
   * Try to encode the values.
   *
   * @param values
   *          Long or LocalDate values, nulls allowed
   * @param dates
   *          whether the values are {@link LocalDate}s
   * @return the encoded column or {@code null} when the value range overflows a
   *         long
   */
  static DeltaColumn tryEncode(List<Object> values, boolean dates) {
    long[] raw = new long[values.size()];
    boolean[] nulls = new boolean[values.size()];
    long min = Long.MAX_VALUE;
    long max = Long.MIN_VALUE;
    boolean seen = false;
    for (int i = 0; i < raw.length; i++) {
      Object value = values.get(i);
      if (value == null) {
        nulls[i] = true;
        continue;
      }
      long v = dates ? ((LocalDate) value).toEpochDay() : (Long) value;
      raw[i] = v;
      min = Math.min(min, v);
      max = Math.max(max, v);
      seen = true;
    }
    if (!seen) {
      min = 0L;
      max = 0L;
    }
    for (int i = 0; i < raw.length; i++) {
      if (nulls[i]) {
        raw[i] = min;
      }
    }
    long range;
    try {
      range = Math.subtractExact(max, min);
    } catch (ArithmeticException e) {
      return null;
    }
    return new DeltaColumn(dates, min, range, raw, nulls);
  }

  private static int widthFor(long range) {
    if (range <= 0xFFL) {
      return 1;
    }
    if (range <= 0xFFFFL) {
      return 2;
    }
    if (range <= 0xFFFFFFFFL) {
      return 4;
    }
    return 8;
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public Object get(int index) {
    if (nulls[index]) {
      return null;
    }
    long delta = switch (width) {
      case 1 -> bytes[index] & 0xFFL;
      case 2 -> shorts[index] & 0xFFFFL;
      case 4 -> ints[index] & 0xFFFFFFFFL;
      default -> longs[index];
    };
    long value = base + delta;
    return dates ? LocalDate.ofEpochDay(value) : Long.valueOf(value);
  }

  /**
   * Bytes used per value.
   *
   * @return 1, 2, 4 or 8
   */
  int width() {
    return width;
  }

  @Override
  public Encoding encoding() {
    return Encoding.DELTA;
  }

  @Override
  public long estimatedBytes() {
    return (long) width * size + size / 8 + 8;
  }
}
