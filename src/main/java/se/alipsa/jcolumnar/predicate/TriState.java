package se.alipsa.jcolumnar.predicate;

/**
 * SQL three-valued logic.
 */
public enum TriState {
  TRUE, FALSE, UNKNOWN;

  /**
   * Convert a boolean.
   *
   * @param value
   *          the boolean
   * @return {@link #TRUE} or {@link #FALSE}
   */
  public static TriState of(boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * Logical AND: FALSE dominates, then UNKNOWN.
   *
   * @param other
   *          the right operand
   * @return the conjunction
   */
  public TriState and(TriState other) {
    if (this == FALSE || other == FALSE) {
      return FALSE;
    }
    if (this == UNKNOWN || other == UNKNOWN) {
      return UNKNOWN;
    }
    return TRUE;
  }

  /**
   * Logical OR: TRUE dominates, then UNKNOWN.
   *
   * @param other
   *          the right operand
   * @return the disjunction
   */
  public TriState or(TriState other) {
    if (this == TRUE || other == TRUE) {
      return TRUE;
    }
    if (this == UNKNOWN || other == UNKNOWN) {
      return UNKNOWN;
    }
    return FALSE;
  }

  /**
   * Logical NOT; UNKNOWN stays UNKNOWN.
   *
   * @return the negation
   */
  public TriState not() {
    return switch (this) {
      case TRUE -> FALSE;
      case FALSE -> TRUE;
      case UNKNOWN -> UNKNOWN;
    };
  }

  /**
   * Whether a row with this result passes a WHERE or HAVING clause.
   *
   * @return {@code true} only for {@link #TRUE}
   */
  public boolean isTrue() {
    return this == TRUE;
  }
}
