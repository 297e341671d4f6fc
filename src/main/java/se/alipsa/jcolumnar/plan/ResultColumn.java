package se.alipsa.jcolumnar.plan;

import java.util.Objects;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Name and type of a column produced by an operator.
 *
 * @param name
 *          the column name
 * @param type
 *          the value type
 */
public record ResultColumn(String name, DataType type) {

  /**
   * Validating constructor.
   */
  public ResultColumn {
    Objects.requireNonNull(name, "name");
  }
}
