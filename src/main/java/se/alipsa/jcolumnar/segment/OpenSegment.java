package se.alipsa.jcolumnar.segment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.RowRange;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.store.Values;
import se.alipsa.jcolumnar.store.codec.EncodedColumn;
import se.alipsa.jcolumnar.store.codec.Encoding;

/**
 * The open tail of a table: append-only column buffers with statistics kept
 * up to date row by row.
 *
 * <p>
 * {@link #publish} hands out a segment that views the first {@code n} slots of
 * the current buffers. Slots below {@code n} are never written again and a
 * full buffer is replaced by a larger copy, so a published segment stays
 * valid while appends continue. Not thread safe; the owning table serializes
 * appends.
 * </p>
 */
public final class OpenSegment {

  private static final int INITIAL_CAPACITY = 16;

  private final TableSchema schema;
  private final int capacity;
  private final int distinctLimit;
  private ColumnBuffer[] buffers;
  private int rows;

  /**
   * Create an empty open segment.
   *
   * @param schema
   *          the table schema
   * @param capacity
   *          the segment capacity; buffers never grow beyond it
   * @param distinctLimit
   *          largest distinct count for which statistics keep the value set
   */
  public OpenSegment(TableSchema schema, int capacity, int distinctLimit) {
    this.schema = schema;
    this.capacity = capacity;
    this.distinctLimit = distinctLimit;
    reset();
  }

  public int rowCount() {
    return rows;
  }

  /**
   * Append one normalized row, in schema order.
   *
   * @param row
   *          the values
   */
  public void add(Object[] row) {
    if (rows == capacity) {
      throw new IllegalStateException("Open segment of " + schema.name() + " is full");
    }
    for (int c = 0; c < buffers.length; c++) {
      buffers[c].add(row[c]);
    }
    rows++;
  }

  /**
   * The buffered values of every column, in schema order, for sealing.
   *
   * @return one list per column
   */
  public List<List<Object>> columns() {
    List<List<Object>> columns = new ArrayList<>(buffers.length);
    for (ColumnBuffer buffer : buffers) {
      columns.add(Arrays.asList(Arrays.copyOf(buffer.values, buffer.size)));
    }
    return columns;
  }

  /**
   * Start over with fresh buffers. Segments published earlier keep the old
   * ones.
   */
  public void reset() {
    buffers = new ColumnBuffer[schema.size()];
    for (int c = 0; c < buffers.length; c++) {
      buffers[c] = new ColumnBuffer(Math.min(INITIAL_CAPACITY, capacity));
    }
    rows = 0;
  }

  /**
   * An unsealed segment over the rows buffered so far.
   *
   * @param id
   *          the segment id the tail will keep once sealed
   * @param start
   *          first row ordinal of the segment
   * @param partitionLabel
   *          the partition label shared by all rows, may be {@code null}
   * @return the segment
   */
  public Segment publish(int id, long start, Object partitionLabel) {
    ColumnChunk[] chunks = new ColumnChunk[buffers.length];
    for (int c = 0; c < chunks.length; c++) {
      ColumnDefinition def = schema.columns().get(c);
      ColumnBuffer buffer = buffers[c];
      chunks[c] = new ColumnChunk(def, new BufferView(buffer.values, buffer.size), null, buffer.statistics());
    }
    return Segment.open(id, RowRange.of(start, rows), schema, chunks, partitionLabel);
  }

  private final class ColumnBuffer {
    private Object[] values;
    private int size;
    private int nulls;
    private Object min;
    private Object max;
    private final Set<Object> distinct = new HashSet<>();

    ColumnBuffer(int initialCapacity) {
      this.values = new Object[initialCapacity];
    }

    void add(Object value) {
      if (size == values.length) {
        values = Arrays.copyOf(values, Math.min(capacity, Math.max(1, values.length * 2)));
      }
      values[size++] = value;
      if (value == null) {
        nulls++;
        return;
      }
      distinct.add(value);
      if (min == null || Values.compare(value, min) < 0) {
        min = value;
      }
      if (max == null || Values.compare(value, max) > 0) {
        max = value;
      }
    }

    ColumnStatistics statistics() {
      Set<Object> retained = distinct.size() <= distinctLimit ? new HashSet<>(distinct) : null;
      return new ColumnStatistics(size, nulls, min, max, distinct.size(), retained);
    }
  }

  private static final class BufferView implements EncodedColumn {
    private final Object[] values;
    private final int size;

    BufferView(Object[] values, int size) {
      this.values = values;
      this.size = size;
    }

    @Override
    public int size() {
      return size;
    }

    @Override
    public Object get(int index) {
      if (index < 0 || index >= size) {
        throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + size);
      }
      return values[index];
    }

    @Override
    public Encoding encoding() {
      return Encoding.PLAIN;
    }

    @Override
    public long estimatedBytes() {
      return 16L * size;
    }
  }
}
