package se.alipsa.jcolumnar.store.codec;

import java.math.BigDecimal;
import java.util.List;

/**
 * Decimal column slice stored as unscaled longs at the column scale.
 */
final class FixedPointColumn implements EncodedColumn {

  private final long[] unscaled;
  private final boolean[] nulls;
  private final int scale;

  private FixedPointColumn(long[] unscaled, boolean[] nulls, int scale) {
    this.unscaled = unscaled;
    this.nulls = nulls;
    this.scale = scale;
  }

  /**
   * Try to encode the values.
   *
   * @param values
   *          BigDecimal values already at {@code scale}, nulls allowed
   * @param scale
   *          the column scale
   * @return the encoded column or {@code null} if an unscaled value does not fit
   *         in a long
   */
  static FixedPointColumn tryEncode(List<Object> values, int scale) {
    long[] unscaled = new long[values.size()];
    boolean[] nulls = new boolean[values.size()];
    for (int i = 0; i < unscaled.length; i++) {
      BigDecimal value = (BigDecimal) values.get(i);
      if (value == null) {
        nulls[i] = true;
        continue;
      }
      try {
        unscaled[i] = value.setScale(scale).unscaledValue().longValueExact();
      } catch (ArithmeticException e) {
        return null;
      }
    }
    return new FixedPointColumn(unscaled, nulls, scale);
  }

  @Override
  public int size() {
    return unscaled.length;
  }

  @Override
  public Object get(int index) {
    return nulls[index] ? null : BigDecimal.valueOf(unscaled[index], scale);
  }

  @Override
  public Encoding encoding() {
    return Encoding.FIXED_POINT;
  }

  @Override
  public long estimatedBytes() {
    return 8L * unscaled.length + unscaled.length / 8;
  }
}
