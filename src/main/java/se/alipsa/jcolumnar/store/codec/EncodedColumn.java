package se.alipsa.jcolumnar.store.codec;

/**
 * Read-only, random access view of one column slice in its encoded form.
 * Positions holding {@code null} are tracked by the owning chunk's null bitmap;
 * implementations return {@code null} for them.
 */
public interface EncodedColumn {

  /**
   * Number of values, nulls included.
   *
   * @return the value count
   */
  int size();

  /**
   * Decode the value at a position.
   *
   * @param index
   *          zero based position
   * @return the decoded value or {@code null}
   */
  Object get(int index);

  /**
   * The encoding used.
   *
   * @return the encoding
   */
  Encoding encoding();

  /**
   * Approximate number of bytes used by the encoded payload.
   *
   * @return the estimated size in bytes
   */
  long estimatedBytes();
}
