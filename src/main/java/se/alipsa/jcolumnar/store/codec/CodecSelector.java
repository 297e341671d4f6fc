package se.alipsa.jcolumnar.store.codec;

import java.util.List;
import se.alipsa.jcolumnar.store.ColumnDefinition;

/**
 * Chooses the encoding of a column slice from its type and value distribution
 * when a segment is closed.
 */
public final class CodecSelector {

  private final int dictionaryThreshold;

  /**
   * Create a selector.
   *
   * @param dictionaryThreshold
   *          maximum number of distinct strings for dictionary encoding
   */
  public CodecSelector(int dictionaryThreshold) {
    if (dictionaryThreshold < 0) {
      throw new IllegalArgumentException("dictionaryThreshold must not be negative: " + dictionaryThreshold);
    }
    this.dictionaryThreshold = dictionaryThreshold;
  }

  /**
   * Encode a closed segment column.
   *
   * @param column
   *          the column definition
   * @param values
   *          the normalized values
   * @param distinctCount
   *          number of distinct non-null values
   * @return the encoded column
   */
  public EncodedColumn encode(ColumnDefinition column, List<Object> values, int distinctCount) {
    EncodedColumn encoded = switch (column.type()) {
      case STRING -> distinctCount <= dictionaryThreshold && distinctCount <= Short.MAX_VALUE
          ? new DictionaryColumn(values) : null;
      case INTEGER -> DeltaColumn.tryEncode(values, false);
      case DATE -> DeltaColumn.tryEncode(values, true);
      case DECIMAL -> FixedPointColumn.tryEncode(values, column.scale());
      case DOUBLE -> null;
    };
    return encoded == null ? plain(values) : encoded;
  }

  private static EncodedColumn plain(List<Object> values) {
    return new PlainColumn(values);
  }
}
