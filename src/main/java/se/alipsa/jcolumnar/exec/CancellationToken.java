package se.alipsa.jcolumnar.exec;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal of one query. The executor checks it between
 * segments and between window partitions; a partition that has started always
 * runs to completion.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Request cancellation. Safe to call from any thread, more than once. */
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Abort the current stage if cancellation was requested.
   *
   * @param stage
   *          the stage checking the token
   * @throws QueryCancelledException
   *           if cancelled
   */
  public void throwIfCancelled(String stage) {
    if (cancelled.get()) {
      throw new QueryCancelledException(stage);
    }
  }
}
