package se.alipsa.jcolumnar.window;

/**
 * How frame offsets are measured.
 */
public enum FrameUnit {
  /** Offsets count physical rows. */
  ROWS,
  /** Offsets are distances in the value of the single ORDER BY key. */
  RANGE
}
