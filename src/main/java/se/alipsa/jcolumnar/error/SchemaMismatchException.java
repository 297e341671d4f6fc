package se.alipsa.jcolumnar.error;

/**
 * Thrown when a row batch or table definition does not match the declared
 * table schema. Raised before any data is written, so appends are
 * all-or-nothing.
 */
public class SchemaMismatchException extends ColumnarException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param stage
   *          the stage that detected the problem
   * @param table
   *          the offending table, may be {@code null}
   * @param column
   *          the offending column, may be {@code null}
   * @param message
   *          description of the problem
   */
  public SchemaMismatchException(String stage, String table, String column, String message) {
    super(ErrorKind.SCHEMA_MISMATCH, stage, table, column, message, null);
  }

  /**
   * Create a new exception with an underlying cause.
   *
   * @param stage
   *          the stage that detected the problem
   * @param table
   *          the offending table, may be {@code null}
   * @param column
   *          the offending column, may be {@code null}
   * @param message
   *          description of the problem
   * @param cause
   *          the underlying cause
   */
  public SchemaMismatchException(String stage, String table, String column, String message, Throwable cause) {
    super(ErrorKind.SCHEMA_MISMATCH, stage, table, column, message, cause);
  }
}
