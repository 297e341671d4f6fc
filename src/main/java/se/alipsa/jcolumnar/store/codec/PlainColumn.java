package se.alipsa.jcolumnar.store.codec;

import java.util.List;

/**
 * Unencoded column slice, used when no codec fits.
 */
final class PlainColumn implements EncodedColumn {

  private final Object[] values;

  PlainColumn(List<Object> values) {
    this.values = values.toArray();
  }

  @Override
  public int size() {
    return values.length;
  }

  @Override
  public Object get(int index) {
    return values[index];
  }

  @Override
  public Encoding encoding() {
    return Encoding.PLAIN;
  }

  @Override
  public long estimatedBytes() {
    return 16L * values.length;
  }
}
