package se.alipsa.jcolumnar.error;

import java.util.concurrent.ExecutionException;

/**
 * Translates failures of tasks run on the worker pool back into the typed
 * exceptions callers expect.
 */
public final class TaskFailures {

  private TaskFailures() {
  }

  /**
   * Unwrap the failure of a worker task.
   *
   * @param e
   *          the execution failure
   * @param stage
   *          the stage that ran the task
   * @param table
   *          the table involved, may be {@code null}
   * @return the exception to throw
   */
  public static RuntimeException unwrap(ExecutionException e, String stage, String table) {
    Throwable cause = e.getCause() == null ? e : e.getCause();
    if (cause instanceof ColumnarException columnar) {
      return columnar;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new PlanException(stage, table, null, "Worker task failed: " + cause, cause);
  }

  /**
   * Handle an interrupt while waiting for worker tasks.
   *
   * @param e
   *          the interrupt
   * @param stage
   *          the waiting stage
   * @param table
   *          the table involved, may be {@code null}
   * @return the exception to throw
   */
  public static RuntimeException interrupted(InterruptedException e, String stage, String table) {
    Thread.currentThread().interrupt();
    return new PlanException(stage, table, null, "Interrupted while waiting for worker tasks", e);
  }
}
