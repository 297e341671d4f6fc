package se.alipsa.jcolumnar.exec;

import se.alipsa.jcolumnar.predicate.BatchView;
import se.alipsa.jcolumnar.segment.Segment;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Decodes the chunks of one segment on demand for predicate evaluation.
 */
final class SegmentBatch implements BatchView {

  private final Segment segment;

  SegmentBatch(Segment segment) {
    this.segment = segment;
  }

  @Override
  public int rowCount() {
    return segment.rowCount();
  }

  @Override
  public int columnIndex(String name) {
    return segment.schema().indexOf(name);
  }

  @Override
  public DataType columnType(int column) {
    return segment.schema().columns().get(column).type();
  }

  @Override
  public Object value(int column, int row) {
    return segment.chunk(column).get(row);
  }
}
