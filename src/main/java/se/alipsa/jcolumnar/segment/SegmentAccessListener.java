package se.alipsa.jcolumnar.segment;

/**
 * Observer of segment accesses performed by a scan. Implementations must be
 * thread safe since segments are decoded on worker threads.
 */
public interface SegmentAccessListener {

  /** Listener that ignores all events. */
  SegmentAccessListener NONE = new SegmentAccessListener() {
    @Override
    public void segmentScanned(String table, int segmentId) {
      // ignore
    }

    @Override
    public void segmentPruned(String table, int segmentId) {
      // ignore
    }
  };

  /**
   * Called when a segment is decoded and filtered.
   *
   * @param table
   *          the table name
   * @param segmentId
   *          the segment id
   */
  void segmentScanned(String table, int segmentId);

  /**
   * Called when a segment is excluded by its statistics.
   *
   * @param table
   *          the table name
   * @param segmentId
   *          the segment id
   */
  void segmentPruned(String table, int segmentId);
}
