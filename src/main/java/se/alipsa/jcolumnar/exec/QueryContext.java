package se.alipsa.jcolumnar.exec;

import se.alipsa.jcolumnar.segment.SegmentAccessListener;

/**
 * Per query state supplied by the caller.
 *
 * @param cancellation
 *          the cancellation token
 * @param accessListener
 *          observer of scanned and pruned segments
 */
public record QueryContext(CancellationToken cancellation, SegmentAccessListener accessListener) {

  /**
   * Defaulting constructor.
   */
  public QueryContext {
    cancellation = cancellation == null ? new CancellationToken() : cancellation;
    accessListener = accessListener == null ? SegmentAccessListener.NONE : accessListener;
  }

  /**
   * A context with a fresh token and no listener.
   *
   * @return the context
   */
  public static QueryContext create() {
    return new QueryContext(null, null);
  }

  public QueryContext withCancellation(CancellationToken token) {
    return new QueryContext(token, accessListener);
  }

  public QueryContext withAccessListener(SegmentAccessListener listener) {
    return new QueryContext(cancellation, listener);
  }
}
