package se.alipsa.jcolumnar.store;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Logical column types together with the Java class used to represent their
 * values.
 */
public enum DataType {
  INTEGER(Long.class),
  DECIMAL(BigDecimal.class),
  DOUBLE(Double.class),
  DATE(LocalDate.class),
  STRING(String.class);

  private final Class<?> javaType;

  DataType(Class<?> javaType) {
    this.javaType = javaType;
  }

  /**
   * Retrieve the Java class values of this type are stored as.
   *
   * @return the value class
   */
  public Class<?> javaType() {
    return javaType;
  }

  /**
   * Whether values of this type take part in arithmetic.
   *
   * @return {@code true} for INTEGER, DECIMAL and DOUBLE
   */
  public boolean isNumeric() {
    return this == INTEGER || this == DECIMAL || this == DOUBLE;
  }

  /**
   * Infer the data type of a (normalized) value.
   *
   * @param value
   *          the value, may be {@code null}
   * @return the matching type or {@code null} for {@code null} or unsupported
   *         values
   */
  public static DataType of(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return INTEGER;
    }
    if (value instanceof BigDecimal) {
      return DECIMAL;
    }
    if (value instanceof Double || value instanceof Float) {
      return DOUBLE;
    }
    if (value instanceof LocalDate) {
      return DATE;
    }
    if (value instanceof String) {
      return STRING;
    }
    return null;
  }
}
