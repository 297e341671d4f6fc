package se.alipsa.jcolumnar.segment;

import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.RowRange;
import se.alipsa.jcolumnar.store.codec.Encoding;

/**
 * Read-only summary of one column within one segment.
 *
 * @param segmentId
 *          the segment id
 * @param rowRange
 *          rows covered by the segment
 * @param column
 *          the column name
 * @param type
 *          the column type
 * @param encoding
 *          the encoding chosen for the chunk
 * @param statistics
 *          the chunk statistics
 */
public record SegmentDescriptor(int segmentId, RowRange rowRange, String column, DataType type, Encoding encoding,
    ColumnStatistics statistics) {
}
