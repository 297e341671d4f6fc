package se.alipsa.jcolumnar.predicate;

import java.util.List;
import java.util.Objects;

/**
 * Boolean expression tree evaluated with SQL three-valued logic. Each variant
 * is an immutable record.
 */
public interface Predicate {

  /**
   * {@code left op right}.
   *
   * @param operator
   *          the comparison operator
   * @param left
   *          left operand
   * @param right
   *          right operand
   */
  record Comparison(ComparisonOperator operator, Operand left, Operand right) implements Predicate {
    public Comparison {
      Objects.requireNonNull(operator, "operator");
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return left + " " + operator.symbol() + " " + right;
    }
  }

  /**
   * Conjunction.
   *
   * @param left
   *          left predicate
   * @param right
   *          right predicate
   */
  record And(Predicate left, Predicate right) implements Predicate {
    public And {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return "(" + left + " AND " + right + ")";
    }
  }

  /**
   * Disjunction.
   *
   * @param left
   *          left predicate
   * @param right
   *          right predicate
   */
  record Or(Predicate left, Predicate right) implements Predicate {
    public Or {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
      return "(" + left + " OR " + right + ")";
    }
  }

  /**
   * Negation.
   *
   * @param predicate
   *          the negated predicate
   */
  record Not(Predicate predicate) implements Predicate {
    public Not {
      Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public String toString() {
      return "NOT " + predicate;
    }
  }

  /**
   * {@code operand [NOT] BETWEEN low AND high}, both bounds inclusive.
   *
   * @param operand
   *          the tested operand
   * @param low
   *          lower bound
   * @param high
   *          upper bound
   * @param negated
   *          whether this is NOT BETWEEN
   */
  record Between(Operand operand, Operand low, Operand high, boolean negated) implements Predicate {
    public Between {
      Objects.requireNonNull(operand, "operand");
      Objects.requireNonNull(low, "low");
      Objects.requireNonNull(high, "high");
    }

    @Override
    public String toString() {
      return operand + (negated ? " NOT" : "") + " BETWEEN " + low + " AND " + high;
    }
  }

  /**
   * {@code operand [NOT] IN (values)}.
   *
   * @param operand
   *          the tested operand
   * @param values
   *          the candidate values
   * @param negated
   *          whether this is NOT IN
   */
  record In(Operand operand, List<Operand> values, boolean negated) implements Predicate {
    public In {
      Objects.requireNonNull(operand, "operand");
      values = List.copyOf(values);
      if (values.isEmpty()) {
        throw new IllegalArgumentException("IN requires at least one value");
      }
    }

    @Override
    public String toString() {
      return operand + (negated ? " NOT" : "") + " IN " + values;
    }
  }

  /**
   * {@code operand IS [NOT] NULL}.
   *
   * @param operand
   *          the tested operand
   * @param negated
   *          whether this is IS NOT NULL
   */
  record IsNull(Operand operand, boolean negated) implements Predicate {
    public IsNull {
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public String toString() {
      return operand + (negated ? " IS NOT NULL" : " IS NULL");
    }
  }
}
