package se.alipsa.jcolumnar.predicate;

/**
 * Binary comparison operators.
 */
public enum ComparisonOperator {
  EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">=");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /**
   * Apply the operator to a comparison result.
   *
   * @param cmp
   *          result of comparing left with right
   * @return whether the comparison holds
   */
  public boolean test(int cmp) {
    return switch (this) {
      case EQ -> cmp == 0;
      case NE -> cmp != 0;
      case LT -> cmp < 0;
      case LE -> cmp <= 0;
      case GT -> cmp > 0;
      case GE -> cmp >= 0;
    };
  }

  /**
   * Operator obtained by swapping the operands ({@code a < b} becomes
   * {@code b > a}).
   *
   * @return the mirrored operator
   */
  public ComparisonOperator flip() {
    return switch (this) {
      case EQ, NE -> this;
      case LT -> GT;
      case LE -> GE;
      case GT -> LT;
      case GE -> LE;
    };
  }

  /**
   * Logical complement for non-null operands ({@code a < b} becomes
   * {@code a >= b}).
   *
   * @return the negated operator
   */
  public ComparisonOperator negate() {
    return switch (this) {
      case EQ -> NE;
      case NE -> EQ;
      case LT -> GE;
      case LE -> GT;
      case GT -> LE;
      case GE -> LT;
    };
  }
}
