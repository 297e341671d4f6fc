package se.alipsa.jcolumnar.plan;

import java.util.Objects;

/**
 * One output column of a projection.
 *
 * @param column
 *          the input column
 * @param alias
 *          the output name
 */
public record ProjectItem(String column, String alias) {

  /**
   * Validating constructor; a missing alias keeps the column name.
   */
  public ProjectItem {
    Objects.requireNonNull(column, "column");
    alias = alias == null ? column : alias;
  }

  public static ProjectItem of(String column) {
    return new ProjectItem(column, column);
  }

  public static ProjectItem of(String column, String alias) {
    return new ProjectItem(column, alias);
  }
}
