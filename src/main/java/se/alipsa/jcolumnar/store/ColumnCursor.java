package se.alipsa.jcolumnar.store;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import se.alipsa.jcolumnar.segment.ColumnChunk;
import se.alipsa.jcolumnar.segment.Segment;

/**
 * Lazy iterator over the decoded values of one column in a row range. Values
 * are decoded on demand from the segments of the snapshot the cursor was
 * created from.
 */
public final class ColumnCursor implements Iterator<Object> {

  private final List<Segment> segments;
  private final int columnIndex;
  private final long end;
  private long position;
  private int segmentIdx;

  ColumnCursor(List<Segment> segments, int columnIndex, RowRange range) {
    this.segments = segments;
    this.columnIndex = columnIndex;
    this.position = range.start();
    this.end = range.end();
    this.segmentIdx = 0;
  }

  @Override
  public boolean hasNext() {
    return position < end;
  }

  @Override
  public Object next() {
    if (!hasNext()) {
      throw new NoSuchElementException("End of column range reached at row " + position);
    }
    Segment segment = segments.get(segmentIdx);
    while (position >= segment.rowRange().end()) {
      segment = segments.get(++segmentIdx);
    }
    ColumnChunk chunk = segment.chunk(columnIndex);
    Object value = chunk.get((int) (position - segment.rowRange().start()));
    position++;
    return value;
  }

  /**
   * Number of values not yet returned.
   *
   * @return the remaining count
   */
  public long remaining() {
    return end - position;
  }
}
