package se.alipsa.jcolumnar.error;

/**
 * Thrown when a logical plan is malformed or uses an unsupported operator composition.
 */
public class PlanException extends ColumnarException {

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
  public PlanException(String stage, String table, String column, String message) {
    super(ErrorKind.PLAN_ERROR, stage, table, column, message, null);
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
  public PlanException(String stage, String table, String column, String message, Throwable cause) {
    super(ErrorKind.PLAN_ERROR, stage, table, column, message, cause);
  }
}
