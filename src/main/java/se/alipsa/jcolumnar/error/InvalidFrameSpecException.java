package se.alipsa.jcolumnar.error;

/**
 * Thrown when a window frame specification is malformed, for example when
 * the frame start lies after the frame end. Detected while the plan is
 * validated, never during row evaluation.
 */
public class InvalidFrameSpecException extends ColumnarException {

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
  public InvalidFrameSpecException(String stage, String table, String column, String message) {
    super(ErrorKind.INVALID_FRAME_SPEC, stage, table, column, message, null);
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
  public InvalidFrameSpecException(String stage, String table, String column, String message, Throwable cause) {
    super(ErrorKind.INVALID_FRAME_SPEC, stage, table, column, message, cause);
  }
}
