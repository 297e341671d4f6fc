package se.alipsa.jcolumnar.error;

/**
 * Thrown when segment pruning excluded a segment containing matching rows. This always indicates an engine bug.
 */
public class PruneInconsistencyException extends ColumnarException {

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
  public PruneInconsistencyException(String stage, String table, String column, String message) {
    super(ErrorKind.PRUNE_INCONSISTENCY, stage, table, column, message, null);
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
  public PruneInconsistencyException(String stage, String table, String column, String message, Throwable cause) {
    super(ErrorKind.PRUNE_INCONSISTENCY, stage, table, column, message, cause);
  }
}
