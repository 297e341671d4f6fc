package se.alipsa.jcolumnar.segment;

import java.util.BitSet;
import java.util.List;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.codec.EncodedColumn;
import se.alipsa.jcolumnar.store.codec.Encoding;

/**
 * The values of one column inside one segment: encoded payload, null bitmap
 * and statistics. Chunks of the open tail carry no bitmap; their plain payload
 * holds the nulls itself.
 */
public final class ColumnChunk {

  private final ColumnDefinition column;
  private final EncodedColumn data;
  private final BitSet nulls;
  private final ColumnStatistics statistics;

  ColumnChunk(ColumnDefinition column, EncodedColumn data, BitSet nulls, ColumnStatistics statistics) {
    this.column = column;
    this.data = data;
    this.nulls = nulls;
    this.statistics = statistics;
  }

  static BitSet nullBitmap(List<Object> values) {
    BitSet bits = new BitSet(values.size());
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) == null) {
        bits.set(i);
      }
    }
    return bits;
  }

  public ColumnDefinition column() {
    return column;
  }

  public ColumnStatistics statistics() {
    return statistics;
  }

  public Encoding encoding() {
    return data.encoding();
  }

  /**
   * Number of values in the chunk.
   *
   * @return the row count of the owning segment
   */
  public int size() {
    return data.size();
  }

  /**
   * Whether the value at a position is null.
   *
   * @param index
   *          position relative to the segment start
   * @return {@code true} if null
   */
  public boolean isNull(int index) {
    return nulls == null ? data.get(index) == null : nulls.get(index);
  }

  /**
   * Decode one value.
   *
   * @param index
   *          position relative to the segment start
   * @return the decoded value or {@code null}
   */
  public Object get(int index) {
    if (nulls != null && nulls.get(index)) {
      return null;
    }
    return data.get(index);
  }

  /**
   * Approximate memory used by the encoded payload.
   *
   * @return bytes
   */
  public long estimatedBytes() {
    return data.estimatedBytes() + (nulls == null ? 0 : nulls.size() / 8);
  }
}
