package se.alipsa.jcolumnar.error;

import java.util.Objects;

/**
 * Base class of all typed failures raised by the engine. Every instance carries
 * the {@link ErrorKind}, the stage (operator) where it was detected and, when
 * applicable, the table and column involved.
 */
public abstract class ColumnarException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final String stage;
  private final String table;
  private final String column;

  /**
   * Create a new exception.
   *
   * @param kind
   *          the error classification
   * @param stage
   *          the operator or stage that detected the problem
   * @param table
   *          the offending table, may be {@code null}
   * @param column
   *          the offending column, may be {@code null}
   * @param message
   *          a human readable description
   * @param cause
   *          the underlying cause, may be {@code null}
   */
  protected ColumnarException(ErrorKind kind, String stage, String table, String column, String message,
      Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.stage = stage;
    this.table = table;
    this.column = column;
  }

  /**
   * Retrieve the error classification.
   *
   * @return the {@link ErrorKind}
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Retrieve the stage or operator where the failure occurred.
   *
   * @return the stage name, may be {@code null}
   */
  public String stage() {
    return stage;
  }

  /**
   * Retrieve the offending table name.
   *
   * @return the table name or {@code null} when not applicable
   */
  public String table() {
    return table;
  }

  /**
   * Retrieve the offending column name.
   *
   * @return the column name or {@code null} when not applicable
   */
  public String column() {
    return column;
  }

  @Override
  public String getMessage() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind);
    if (stage != null) {
      sb.append(" [stage=").append(stage);
      if (table != null) {
        sb.append(", table=").append(table);
      }
      if (column != null) {
        sb.append(", column=").append(column);
      }
      sb.append(']');
    } else if (table != null || column != null) {
      sb.append(" [table=").append(table).append(", column=").append(column).append(']');
    }
    String detail = super.getMessage();
    if (detail != null && !detail.isBlank()) {
      sb.append(": ").append(detail);
    }
    return sb.toString();
  }
}
