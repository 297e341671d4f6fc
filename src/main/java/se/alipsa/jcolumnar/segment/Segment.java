package se.alipsa.jcolumnar.segment;

import java.util.List;
import se.alipsa.jcolumnar.predicate.StatisticsEvaluator.StatisticsSource;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.RowRange;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.store.codec.CodecSelector;
import se.alipsa.jcolumnar.store.codec.EncodedColumn;

/**
 * An immutable slice of all columns of a table sharing one row range.
 *
 * <p>
 * A segment is either sealed (capacity reached or partition label changed,
 * payload encoded by the {@link CodecSelector}) or the open tail of the table,
 * a plain view over the buffers of an {@link OpenSegment} that is replaced by
 * a new instance on every append. Chunks are aligned: chunk {@code i} holds column {@code i} of the
 * schema and every chunk has {@link #rowCount()} values.
 * </p>
 */
public final class Segment implements StatisticsSource {

  private final int id;
  private final RowRange rowRange;
  private final TableSchema schema;
  private final ColumnChunk[] chunks;
  private final boolean sealed;
  private final Object partitionLabel;

  private Segment(int id, RowRange rowRange, TableSchema schema, ColumnChunk[] chunks, boolean sealed,
      Object partitionLabel) {
    this.id = id;
    this.rowRange = rowRange;
    this.schema = schema;
    this.chunks = chunks;
    this.sealed = sealed;
    this.partitionLabel = partitionLabel;
  }

  /**
   * Build a segment from column value lists.
   *
   * @param id
   *          the segment id, unique within the table
   * @param start
   *          first row ordinal of the segment
   * @param schema
   *          the table schema
   * @param columns
   *          one list of normalized values per schema column, all of equal size
   * @param partitionLabel
   *          the partition label shared by all rows, may be {@code null}
   * @param codecs
   *          the codec selector
   * @param distinctLimit
   *          largest distinct count for which statistics keep the value set
   * @return the segment
   */
  public static Segment build(int id, long start, TableSchema schema, List<List<Object>> columns,
      Object partitionLabel, CodecSelector codecs, int distinctLimit) {
    int rows = columns.get(0).size();
    ColumnChunk[] chunks = new ColumnChunk[schema.size()];
    for (int i = 0; i < chunks.length; i++) {
      ColumnDefinition def = schema.columns().get(i);
      List<Object> values = columns.get(i);
      if (values.size() != rows) {
        throw new IllegalStateException("Column " + def.name() + " has " + values.size() + " values, expected " + rows);
      }
      ColumnStatistics stats = StatisticsCollector.collect(values, distinctLimit);
      EncodedColumn data = codecs.encode(def, values, stats.distinctEstimate());
      chunks[i] = new ColumnChunk(def, data, ColumnChunk.nullBitmap(values), stats);
    }
    return new Segment(id, RowRange.of(start, rows), schema, chunks, true, partitionLabel);
  }

  static Segment open(int id, RowRange rowRange, TableSchema schema, ColumnChunk[] chunks, Object partitionLabel) {
    return new Segment(id, rowRange, schema, chunks, false, partitionLabel);
  }

  public int id() {
    return id;
  }

  public RowRange rowRange() {
    return rowRange;
  }

  public String table() {
    return schema.name();
  }

  public TableSchema schema() {
    return schema;
  }

  /**
   * Whether the segment has been closed and encoded.
   *
   * @return {@code false} for the open tail segment
   */
  public boolean isSealed() {
    return sealed;
  }

  public Object partitionLabel() {
    return partitionLabel;
  }

  /**
   * Number of rows in the segment.
   *
   * @return the row count
   */
  public int rowCount() {
    return (int) rowRange.length();
  }

  /**
   * The chunk of a column.
   *
   * @param columnIndex
   *          index in the schema
   * @return the chunk
   */
  public ColumnChunk chunk(int columnIndex) {
    return chunks[columnIndex];
  }

  /**
   * The chunk of a named column.
   *
   * @param column
   *          the column name, case-insensitive
   * @return the chunk or {@code null} if the column does not exist
   */
  public ColumnChunk chunk(String column) {
    int idx = schema.indexOf(column);
    return idx < 0 ? null : chunks[idx];
  }

  @Override
  public ColumnStatistics statistics(String column) {
    ColumnChunk chunk = chunk(column);
    return chunk == null ? null : chunk.statistics();
  }

  @Override
  public DataType type(String column) {
    ColumnDefinition def = schema.column(column);
    return def == null ? null : def.type();
  }

  @Override
  public String toString() {
    return "Segment{" + schema.name() + "#" + id + " " + rowRange + (sealed ? "" : " open")
        + (partitionLabel == null ? "" : " partition=" + partitionLabel) + "}";
  }
}
