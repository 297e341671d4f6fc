package se.alipsa.jcolumnar.store.codec;

/**
 * Physical encodings a segment column can be stored with.
 */
public enum Encoding {
  /** Values kept as-is in a typed array. */
  PLAIN,
  /** Low-cardinality values mapped to small integer codes. */
  DICTIONARY,
  /** Integers and dates stored as the difference to the segment minimum. */
  DELTA,
  /** Decimals stored as unscaled longs at the column scale. */
  FIXED_POINT
}
