package se.alipsa.jcolumnar.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.EngineConfig;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.error.SchemaMismatchException;
import se.alipsa.jcolumnar.segment.Segment;

/**
 * Append-only, in-memory store of column oriented tables.
 *
 * <p>
 * Rows are appended in batches and cut into aligned segments of
 * {@link EngineConfig#segmentCapacity()} rows (or fewer when the partition
 * label changes). Closed segments are compressed; the open tail stays plain.
 * Readers work on immutable {@link TableSnapshot}s and never block writers.
 * </p>
 */
public class ColumnStore {

  private static final Logger log = LoggerFactory.getLogger(ColumnStore.class);

  private final EngineConfig config;
  private final Map<String, Table> tables = new ConcurrentHashMap<>();

  /**
   * Create a store with the default configuration.
   */
  public ColumnStore() {
    this(EngineConfig.defaults());
  }

  /**
   * Create a store.
   *
   * @param config
   *          the engine configuration
   */
  public ColumnStore(EngineConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Register a new table.
   *
   * @param schema
   *          the table schema
   * @throws SchemaMismatchException
   *           if a table with the same name exists
   */
  public void createTable(TableSchema schema) {
    Objects.requireNonNull(schema, "schema");
    Table table = new Table(schema, config.segmentCapacity(), config.dictionaryThreshold());
    if (tables.putIfAbsent(TableSchema.normalize(schema.name()), table) != null) {
      throw new SchemaMismatchException("create-table", schema.name(), null, "Table already exists");
    }
    log.info("Created table {} with columns {}", schema.name(), schema.columnNames());
  }

  /**
   * Append a batch of rows. The batch is validated in full before any row is
   * stored.
   *
   * @param tableName
   *          the table name
   * @param batch
   *          the rows to append
   * @return the row ordinals assigned to the batch
   * @throws SchemaMismatchException
   *           if the table is unknown, the column set differs from the schema
   *           or a value does not fit its column
   */
  public RowRange append(String tableName, RowBatch batch) {
    Objects.requireNonNull(batch, "batch");
    Table table = tables.get(TableSchema.normalize(tableName));
    if (table == null) {
      throw new SchemaMismatchException("append", tableName, null, "Unknown table");
    }
    RowRange range = table.append(batch);
    if (log.isDebugEnabled()) {
      log.debug("Appended {} rows to {} at {}", batch.size(), tableName, range);
    }
    return range;
  }

  /**
   * Lazily read the decoded values of a column.
   *
   * @param tableName
   *          the table name
   * @param columnName
   *          the column name
   * @param range
   *          the rows to read
   * @return a cursor over the values
   * @throws IllegalArgumentException
   *           if the range extends past the stored rows
   */
  public ColumnCursor readColumn(String tableName, String columnName, RowRange range) {
    Objects.requireNonNull(range, "range");
    TableSnapshot snapshot = snapshot(tableName);
    int idx = snapshot.schema().indexOf(columnName);
    if (idx < 0) {
      throw new PlanException("scan", snapshot.schema().name(), columnName, "Unknown column");
    }
    if (range.end() > snapshot.rowCount()) {
      throw new IllegalArgumentException("Range " + range + " exceeds the " + snapshot.rowCount() + " rows of table "
          + snapshot.schema().name());
    }
    List<Segment> overlapping = new ArrayList<>();
    for (Segment segment : snapshot.segments()) {
      if (segment.rowRange().overlaps(range)) {
        overlapping.add(segment);
      }
    }
    return new ColumnCursor(overlapping, idx, range);
  }

  /**
   * The current snapshot of a table.
   *
   * @param tableName
   *          the table name
   * @return the published snapshot
   * @throws PlanException
   *           if the table does not exist
   */
  public TableSnapshot snapshot(String tableName) {
    Table table = tables.get(TableSchema.normalize(tableName));
    if (table == null) {
      throw new PlanException("scan", tableName, null, "Unknown table");
    }
    return table.snapshot();
  }

  /**
   * Look up a table schema.
   *
   * @param tableName
   *          the table name
   * @return the schema or {@code null} if there is no such table
   */
  public TableSchema schema(String tableName) {
    Table table = tables.get(TableSchema.normalize(tableName));
    return table == null ? null : table.schema();
  }

  /**
   * Names of all tables.
   *
   * @return the table names
   */
  public List<String> tableNames() {
    List<String> names = new ArrayList<>();
    for (Table table : tables.values()) {
      names.add(table.schema().name());
    }
    Collections.sort(names);
    return names;
  }

  public EngineConfig config() {
    return config;
  }
}
