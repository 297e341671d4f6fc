package se.alipsa.jcolumnar.plan;

/**
 * Placement of nulls in an ordering.
 */
public enum NullOrdering {
  /** Nulls last when ascending, first when descending. */
  DEFAULT,
  NULLS_FIRST,
  NULLS_LAST
}
