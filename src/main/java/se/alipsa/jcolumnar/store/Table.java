package se.alipsa.jcolumnar.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.error.SchemaMismatchException;
import se.alipsa.jcolumnar.segment.ColumnChunk;
import se.alipsa.jcolumnar.segment.OpenSegment;
import se.alipsa.jcolumnar.segment.Segment;
import se.alipsa.jcolumnar.store.codec.CodecSelector;

/**
 * Storage of one table. Appends are serialized by a lock; every append ends by
 * publishing a fresh {@link TableSnapshot} so readers never see a segment that
 * is still being built.
 */
final class Table {

  private static final Logger log = LoggerFactory.getLogger(Table.class);

  private final TableSchema schema;
  private final int capacity;
  private final int distinctLimit;
  private final CodecSelector codecs;
  private final ReentrantLock appendLock = new ReentrantLock();
  private final List<Segment> sealed = new ArrayList<>();
  private final OpenSegment open;
  private long openStart;
  private Object openLabel;
  private int nextSegmentId;
  private volatile TableSnapshot snapshot;

  Table(TableSchema schema, int capacity, int dictionaryThreshold) {
    this.schema = schema;
    this.capacity = capacity;
    this.distinctLimit = dictionaryThreshold;
    this.codecs = new CodecSelector(dictionaryThreshold);
    this.open = new OpenSegment(schema, capacity, dictionaryThreshold);
    this.snapshot = TableSnapshot.empty(schema);
  }

  TableSchema schema() {
    return schema;
  }

  TableSnapshot snapshot() {
    return snapshot;
  }

  /**
   * Validate and append a batch.
   *
   * @return the row range the batch occupies
   */
  RowRange append(RowBatch batch) {
    Object[][] rows = validate(batch);
    appendLock.lock();
    try {
      long first = snapshot.rowCount();
      int keyIdx = schema.partitionScheme().isPartitioned() ? schema.indexOf(schema.partitionScheme().column()) : -1;
      for (Object[] row : rows) {
        Object label = keyIdx < 0 ? null : schema.partitionScheme().label(row[keyIdx]);
        if (keyIdx >= 0 && openRows() > 0 && !Objects.equals(label, openLabel)) {
          seal();
        }
        if (openRows() == 0) {
          openLabel = label;
        }
        open.add(row);
        if (openRows() == capacity) {
          seal();
        }
      }
      publish();
      return RowRange.of(first, rows.length);
    } finally {
      appendLock.unlock();
    }
  }

  private int openRows() {
    return open.rowCount();
  }

  private void seal() {
    Segment segment = Segment.build(nextSegmentId++, openStart, schema, open.columns(), openLabel, codecs,
        distinctLimit);
    sealed.add(segment);
    if (log.isDebugEnabled()) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < schema.size(); i++) {
        ColumnChunk chunk = segment.chunk(i);
        sb.append(i == 0 ? "" : ", ").append(chunk.column().name()).append('=').append(chunk.encoding());
      }
      log.debug("Sealed {} with encodings [{}]", segment, sb);
    }
    openStart += segment.rowCount();
    open.reset();
    openLabel = null;
  }

  private void publish() {
    List<Segment> segments = new ArrayList<>(sealed);
    long rowCount = openStart;
    if (openRows() > 0) {
      // the open tail keeps its id until it is sealed
      Segment openSegment = open.publish(nextSegmentId, openStart, openLabel);
      segments.add(openSegment);
      rowCount += openSegment.rowCount();
    }
    snapshot = new TableSnapshot(schema, segments, rowCount);
  }

  private Object[][] validate(RowBatch batch) {
    List<String> batchColumns = batch.columns();
    if (batchColumns.size() != schema.size()) {
      throw new SchemaMismatchException("append", schema.name(), null,
          "Batch has " + batchColumns.size() + " columns but the table declares " + schema.size() + " "
              + schema.columnNames());
    }
    int[] positions = new int[schema.size()];
    boolean[] seen = new boolean[schema.size()];
    for (int i = 0; i < batchColumns.size(); i++) {
      int idx = schema.indexOf(batchColumns.get(i));
      if (idx < 0) {
        throw new SchemaMismatchException("append", schema.name(), batchColumns.get(i), "Unknown column");
      }
      if (seen[idx]) {
        throw new SchemaMismatchException("append", schema.name(), batchColumns.get(i), "Column supplied twice");
      }
      seen[idx] = true;
      positions[idx] = i;
    }
    Object[][] rows = new Object[batch.size()][];
    for (int r = 0; r < rows.length; r++) {
      Object[] row = new Object[schema.size()];
      for (int c = 0; c < row.length; c++) {
        ColumnDefinition def = schema.columns().get(c);
        Object raw = batch.value(r, positions[c]);
        if (raw == null && !def.nullable()) {
          throw new SchemaMismatchException("append", schema.name(), def.name(),
              "Null value in NOT NULL column at batch row " + r);
        }
        try {
          row[c] = Values.normalize(raw, def);
        } catch (IllegalArgumentException e) {
          throw new SchemaMismatchException("append", schema.name(), def.name(),
              e.getMessage() + " at batch row " + r, e);
        }
      }
      rows[r] = row;
    }
    return rows;
  }
}
