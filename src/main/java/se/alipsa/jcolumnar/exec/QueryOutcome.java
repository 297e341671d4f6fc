package se.alipsa.jcolumnar.exec;

/**
 * Terminal state of a query.
 */
public enum QueryOutcome {
  /** All rows were produced. */
  COMPLETED,
  /** The query was cancelled; the result holds no rows. */
  CANCELLED
}
