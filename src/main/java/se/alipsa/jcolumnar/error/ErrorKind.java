package se.alipsa.jcolumnar.error;

/**
 * Classification of the failures reported by the engine.
 */
public enum ErrorKind {
  /** A row batch or table definition disagrees with the declared schema. */
  SCHEMA_MISMATCH,
  /** A window frame specification is malformed. */
  INVALID_FRAME_SPEC,
  /** Numeric overflow while accumulating an aggregate. */
  AGGREGATE_OVERFLOW,
  /** Malformed or unsupported operator composition. */
  PLAN_ERROR,
  /** Pruning dropped a segment that contains matching rows; always an internal bug. */
  PRUNE_INCONSISTENCY
}
