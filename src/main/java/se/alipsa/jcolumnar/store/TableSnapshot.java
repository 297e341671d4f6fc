package se.alipsa.jcolumnar.store;

import java.util.List;
import se.alipsa.jcolumnar.segment.Segment;

/**
 * Immutable view of a table at one point in time. A new snapshot is published
 * after every append; readers keep using the snapshot they obtained.
 *
 * @param schema
 *          the table schema
 * @param segments
 *          the segments in row order, the last one possibly open
 * @param rowCount
 *          total number of rows
 */
public record TableSnapshot(TableSchema schema, List<Segment> segments, long rowCount) {

  /**
   * Copying constructor.
   */
  public TableSnapshot {
    segments = List.copyOf(segments);
  }

  static TableSnapshot empty(TableSchema schema) {
    return new TableSnapshot(schema, List.of(), 0);
  }
}
