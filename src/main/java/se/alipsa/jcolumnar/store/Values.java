package se.alipsa.jcolumnar.store;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Conversion and comparison helpers shared by storage, predicates and the
 * execution operators.
 */
public final class Values {

  private Values() {
  }

  /**
   * Convert a value supplied by a caller into the canonical representation of a
   * column type.
   *
   * @param value
   *          the raw value, may be {@code null}
   * @param column
   *          the target column
   * @return the normalized value
   * @throws IllegalArgumentException
   *           if the value cannot be represented losslessly
   */
  public static Object normalize(Object value, ColumnDefinition column) {
    if (value == null) {
      return null;
    }
    switch (column.type()) {
      case INTEGER:
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
          return ((Number) value).longValue();
        }
        break;
      case DECIMAL:
        BigDecimal decimal = null;
        if (value instanceof BigDecimal bd) {
          decimal = bd;
        } else if (value instanceof BigInteger bi) {
          decimal = new BigDecimal(bi);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte) {
          decimal = BigDecimal.valueOf(((Number) value).longValue());
        }
        if (decimal != null) {
          try {
            return decimal.setScale(column.scale(), RoundingMode.UNNECESSARY);
          } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                "Value " + decimal + " has more than " + column.scale() + " fractional digits", e);
          }
        }
        break;
      case DOUBLE:
        if (value instanceof Double || value instanceof Float) {
          return ((Number) value).doubleValue();
        }
        break;
      case DATE:
        if (value instanceof LocalDate) {
          return value;
        }
        if (value instanceof java.sql.Date sqlDate) {
          return sqlDate.toLocalDate();
        }
        break;
      case STRING:
        if (value instanceof String) {
          return value;
        }
        break;
      default:
        break;
    }
    throw new IllegalArgumentException(
        "Expected " + column.type() + " value but received " + value.getClass().getSimpleName() + " (" + value + ")");
  }

  /**
   * Coerce a literal so that it can be compared with values of the given type.
   *
   * @param literal
   *          the literal value, may be {@code null}
   * @param target
   *          the type of the other operand, may be {@code null} when unknown
   * @return the coerced literal
   * @throws IllegalArgumentException
   *           if the literal is incompatible with the target type
   */
  public static Object coerce(Object literal, DataType target) {
    if (literal == null || target == null) {
      return literal;
    }
    if (target == DataType.DATE) {
      if (literal instanceof LocalDate) {
        return literal;
      }
      if (literal instanceof java.sql.Date sqlDate) {
        return sqlDate.toLocalDate();
      }
      if (literal instanceof String text) {
        try {
          return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
          throw new IllegalArgumentException("Cannot interpret '" + text + "' as a DATE", e);
        }
      }
    } else if (target.isNumeric()) {
      if (literal instanceof Number) {
        return literal;
      }
      if (literal instanceof String text) {
        try {
          return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Cannot interpret '" + text + "' as a number", e);
        }
      }
    } else if (target == DataType.STRING) {
      if (literal instanceof String) {
        return literal;
      }
    }
    throw new IllegalArgumentException(
        "Literal " + literal + " (" + literal.getClass().getSimpleName() + ") is not comparable with " + target);
  }

  /**
   * Whether two non-null values can be compared with {@link #compare}.
   *
   * @param left
   *          left value
   * @param right
   *          right value
   * @return {@code true} when both are numbers, dates or strings
   */
  public static boolean comparable(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      return true;
    }
    if (left instanceof LocalDate && right instanceof LocalDate) {
      return true;
    }
    return left instanceof String && right instanceof String;
  }

  /**
   * Compare two non-null values of compatible types.
   *
   * @param left
   *          left value
   * @param right
   *          right value
   * @return negative, zero or positive
   * @throws IllegalArgumentException
   *           if the values are not mutually comparable
   */
  public static int compare(Object left, Object right) {
    if (left instanceof Long l && right instanceof Long r) {
      return Long.compare(l, r);
    }
    if (left instanceof Double l && right instanceof Double r) {
      return Double.compare(l, r);
    }
    if (left instanceof Number && right instanceof Number) {
      return toBigDecimal(left).compareTo(toBigDecimal(right));
    }
    if (left instanceof LocalDate l && right instanceof LocalDate r) {
      return l.compareTo(r);
    }
    if (left instanceof String l && right instanceof String r) {
      return l.compareTo(r);
    }
    throw new IllegalArgumentException("Cannot compare " + describe(left) + " with " + describe(right));
  }

  /**
   * Value equality that treats numerically equal numbers of different classes
   * as equal.
   *
   * @param left
   *          left value, may be {@code null}
   * @param right
   *          right value, may be {@code null}
   * @return {@code true} when both are null or compare as equal
   */
  public static boolean same(Object left, Object right) {
    if (left == null || right == null) {
      return left == right;
    }
    if (comparable(left, right)) {
      return compare(left, right) == 0;
    }
    return left.equals(right);
  }

  /**
   * Convert a numeric value to {@link BigDecimal}.
   *
   * @param value
   *          a {@link Number}
   * @return the decimal representation
   */
  public static BigDecimal toBigDecimal(Object value) {
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    throw new IllegalArgumentException("Expected a numeric value but received " + describe(value));
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
  }
}
