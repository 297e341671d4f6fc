package se.alipsa.jcolumnar.store;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.EngineConfig;
import se.alipsa.jcolumnar.error.ErrorKind;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.error.SchemaMismatchException;
import se.alipsa.jcolumnar.segment.ColumnStatistics;
import se.alipsa.jcolumnar.segment.Segment;
import se.alipsa.jcolumnar.store.codec.Encoding;

/**
 * Tests for table creation, appends and column reads.
 */
class ColumnStoreTest {

  private static ColumnStore store(int capacity) {
    return new ColumnStore(EngineConfig.defaults().toBuilder().segmentCapacity(capacity).build());
  }

  private static TableSchema sales() {
    return TableSchema.builder("sales")
        .column(ColumnDefinition.integer("id").notNull())
        .column(ColumnDefinition.string("region"))
        .column(ColumnDefinition.decimal("amount", 2))
        .column(ColumnDefinition.date("day"))
        .build();
  }

  /**
   * Appended values read back in order with their declared types across
   * segment boundaries.
   */
  @Test
  void appendThenReadRoundTrips() {
    ColumnStore store = store(3);
    store.createTable(sales());
    RowBatch.Builder batch = RowBatch.builder("id", "region", "amount", "day");
    List<Object> expectedAmounts = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      BigDecimal amount = i == 4 ? null : new BigDecimal(i + ".25");
      expectedAmounts.add(amount);
      batch.row(i, i % 2 == 0 ? "north" : "south", amount, LocalDate.of(2024, 1, 1).plusDays(i));
    }
    RowRange range = store.append("sales", batch.build());

    Assertions.assertEquals(RowRange.of(0, 8), range, "Unexpected assigned row range");
    Assertions.assertEquals(3, store.snapshot("sales").segments().size(), "Expected 3 + 3 + 2 rows");
    List<Object> amounts = new ArrayList<>();
    store.readColumn("sales", "amount", range).forEachRemaining(amounts::add);
    Assertions.assertEquals(expectedAmounts, amounts, "Amounts must round trip");

    List<Object> ids = new ArrayList<>();
    store.readColumn("sales", "ID", new RowRange(2, 5)).forEachRemaining(ids::add);
    Assertions.assertEquals(List.of(2L, 3L, 4L), ids, "Integers are read back as longs");
  }

  /**
   * Sealed segments are encoded while the open tail stays plain.
   */
  @Test
  void sealedSegmentsAreEncoded() {
    ColumnStore store = store(2);
    store.createTable(sales());
    store.append("sales", RowBatch.builder("id", "region", "amount", "day")
        .row(1, "north", new BigDecimal("1.00"), LocalDate.of(2024, 1, 1))
        .row(2, "north", new BigDecimal("2.00"), LocalDate.of(2024, 1, 2))
        .row(3, "south", new BigDecimal("3.00"), LocalDate.of(2024, 1, 3))
        .build());

    List<Segment> segments = store.snapshot("sales").segments();
    Assertions.assertTrue(segments.get(0).isSealed(), "First segment is full and sealed");
    Assertions.assertEquals(Encoding.DICTIONARY, segments.get(0).chunk("region").encoding());
    Assertions.assertEquals(Encoding.DELTA, segments.get(0).chunk("id").encoding());
    Assertions.assertEquals(Encoding.FIXED_POINT, segments.get(0).chunk("amount").encoding());
    Assertions.assertFalse(segments.get(1).isSealed(), "Tail segment is still open");
    Assertions.assertEquals(Encoding.PLAIN, segments.get(1).chunk("region").encoding());
  }

  /**
   * A failing batch leaves the table untouched.
   */
  @Test
  void schemaMismatchAppendsNothing() {
    ColumnStore store = store(10);
    store.createTable(sales());
    store.append("sales", RowBatch.builder("id", "region", "amount", "day")
        .row(1, "north", null, null).build());

    RowBatch bad = RowBatch.builder("id", "region", "amount", "day")
        .row(2, "north", null, null)
        .row(3, 42, null, null)
        .build();
    SchemaMismatchException e = Assertions.assertThrows(SchemaMismatchException.class,
        () -> store.append("sales", bad));

    Assertions.assertEquals(ErrorKind.SCHEMA_MISMATCH, e.kind());
    Assertions.assertEquals("region", e.column(), "The offending column must be reported");
    Assertions.assertEquals(1, store.snapshot("sales").rowCount(), "No rows of a failed batch may be visible");
  }

  /**
   * Nulls are rejected in NOT NULL columns.
   */
  @Test
  void nullInNotNullColumnIsRejected() {
    ColumnStore store = store(10);
    store.createTable(sales());
    RowBatch batch = RowBatch.builder("id", "region", "amount", "day").row(null, "x", null, null).build();

    SchemaMismatchException e = Assertions.assertThrows(SchemaMismatchException.class,
        () -> store.append("sales", batch));
    Assertions.assertEquals("id", e.column());
  }

  /**
   * Missing or unknown batch columns are rejected.
   */
  @Test
  void batchColumnsMustMatchSchema() {
    ColumnStore store = store(10);
    store.createTable(sales());

    Assertions.assertThrows(SchemaMismatchException.class,
        () -> store.append("sales", RowBatch.builder("id", "region", "amount").row(1, "x", null).build()));
    Assertions.assertThrows(SchemaMismatchException.class, () -> store.append("sales",
        RowBatch.builder("id", "region", "amount", "when").row(1, "x", null, null).build()));
  }

  /**
   * Decimal values with more fractional digits than the column scale are
   * rejected rather than rounded.
   */
  @Test
  void decimalScaleIsEnforced() {
    ColumnStore store = store(10);
    store.createTable(sales());
    RowBatch batch = RowBatch.builder("id", "region", "amount", "day")
        .row(1, "x", new BigDecimal("1.234"), null).build();

    Assertions.assertThrows(SchemaMismatchException.class, () -> store.append("sales", batch));
  }

  /**
   * Batch columns may come in any order.
   */
  @Test
  void batchColumnOrderIsIrrelevant() {
    ColumnStore store = store(10);
    store.createTable(sales());
    store.append("sales", RowBatch.builder("day", "amount", "region", "id")
        .row(LocalDate.of(2024, 2, 1), new BigDecimal("5"), "west", 7).build());

    Assertions.assertEquals("west", store.readColumn("sales", "region", RowRange.of(0, 1)).next());
    Assertions.assertEquals(new BigDecimal("5.00"), store.readColumn("sales", "amount", RowRange.of(0, 1)).next(),
        "Decimals are normalized to the column scale");
  }

  /**
   * Monthly partitioning seals a segment whenever the month changes.
   */
  @Test
  void monthlyPartitionsSplitSegments() {
    ColumnStore store = store(100);
    store.createTable(TableSchema.builder("readings")
        .column(ColumnDefinition.date("day"))
        .column(ColumnDefinition.integer("value"))
        .partitionBy(PartitionScheme.monthly("day"))
        .build());
    store.append("readings", RowBatch.builder("day", "value")
        .row(LocalDate.of(2024, 5, 30), 1)
        .row(LocalDate.of(2024, 5, 31), 2)
        .row(LocalDate.of(2024, 6, 1), 3)
        .row(LocalDate.of(2024, 7, 1), 4)
        .build());

    List<Segment> segments = store.snapshot("readings").segments();
    Assertions.assertEquals(3, segments.size(), "One segment per month");
    Assertions.assertEquals(YearMonth.of(2024, 5), segments.get(0).partitionLabel());
    Assertions.assertEquals(YearMonth.of(2024, 6), segments.get(1).partitionLabel());
    Assertions.assertEquals(2, segments.get(0).rowCount());
  }

  /**
   * Duplicate and unknown tables are reported.
   */
  @Test
  void tableLookupErrors() {
    ColumnStore store = store(10);
    store.createTable(sales());

    Assertions.assertThrows(SchemaMismatchException.class, () -> store.createTable(sales()));
    Assertions.assertThrows(SchemaMismatchException.class,
        () -> store.append("nope", RowBatch.builder("id").row(1).build()));
    Assertions.assertThrows(PlanException.class, () -> store.snapshot("nope"));
    Assertions.assertNull(store.schema("nope"));
  }

  /**
   * Reads beyond the stored rows and of unknown columns fail.
   */
  @Test
  void readColumnValidatesArguments() {
    ColumnStore store = store(10);
    store.createTable(sales());
    store.append("sales", RowBatch.builder("id", "region", "amount", "day").row(1, "x", null, null).build());

    Assertions.assertThrows(IllegalArgumentException.class,
        () -> store.readColumn("sales", "id", RowRange.of(0, 2)));
    Assertions.assertThrows(PlanException.class, () -> store.readColumn("sales", "nope", RowRange.of(0, 1)));
  }

  /**
   * Duplicate column names and a partition key outside the table are schema
   * errors.
   */
  @Test
  void invalidSchemasAreRejected() {
    Assertions.assertThrows(SchemaMismatchException.class, () -> TableSchema.builder("t")
        .column(ColumnDefinition.integer("a")).column(ColumnDefinition.string("A")).build());
    Assertions.assertThrows(SchemaMismatchException.class, () -> TableSchema.builder("t")
        .column(ColumnDefinition.integer("a")).partitionBy(PartitionScheme.monthly("a")).build());
    Assertions.assertThrows(SchemaMismatchException.class, () -> TableSchema.builder("t")
        .column(ColumnDefinition.integer("a")).partitionBy(PartitionScheme.byValue("b")).build());
  }

  /**
   * Readers see either all or none of a concurrently appended batch.
   *
   * @throws Exception
   *           if a worker fails
   */
  @Test
  void concurrentReadersSeeWholeBatches() throws Exception {
    ColumnStore store = store(7);
    store.createTable(TableSchema.builder("t").column(ColumnDefinition.integer("n")).build());
    ExecutorService pool = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      Future<?> writer = pool.submit(() -> {
        start.await();
        for (int b = 0; b < 200; b++) {
          RowBatch.Builder batch = RowBatch.builder("n");
          for (int i = 0; i < 5; i++) {
            batch.row(b);
          }
          store.append("t", batch.build());
        }
        return null;
      });
      Future<?> reader = pool.submit(() -> {
        start.await();
        for (int i = 0; i < 200; i++) {
          long rows = store.snapshot("t").rowCount();
          Assertions.assertEquals(0, rows % 5, "Observed a partially appended batch: " + rows);
        }
        return null;
      });
      start.countDown();
      writer.get(30, TimeUnit.SECONDS);
      reader.get(30, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    Assertions.assertEquals(1000, store.snapshot("t").rowCount());
  }
  /**
   * A snapshot taken earlier keeps its view of the open tail while later
   * appends grow the buffers beneath it.
   */
  @Test
  void openTailSnapshotIsStable() {
    ColumnStore store = store(1000);
    store.createTable(TableSchema.builder("t").column(ColumnDefinition.integer("n")).build());
    for (int i = 0; i < 3; i++) {
      store.append("t", RowBatch.builder("n").row(i).build());
    }
    TableSnapshot before = store.snapshot("t");
    for (int i = 3; i < 100; i++) {
      store.append("t", RowBatch.builder("n").row(i % 10 == 0 ? null : i).build());
    }

    Segment early = before.segments().get(0);
    Assertions.assertEquals(3, early.rowCount());
    Assertions.assertEquals(2L, early.chunk("n").get(2));
    Assertions.assertEquals(2L, early.statistics("n").max(), "Earlier statistics are not affected by later rows");

    Segment tail = store.snapshot("t").segments().get(0);
    Assertions.assertFalse(tail.isSealed());
    Assertions.assertEquals(early.id(), tail.id(), "The open tail keeps its id");
    ColumnStatistics stats = tail.statistics("n");
    Assertions.assertEquals(100, stats.rowCount());
    Assertions.assertEquals(9, stats.nullCount());
    Assertions.assertEquals(0L, stats.min());
    Assertions.assertEquals(99L, stats.max());
    Assertions.assertTrue(tail.chunk("n").isNull(10));
    Assertions.assertEquals(11L, tail.chunk("n").get(11));
  }

  /**
   * Appending one row at a time costs the same per row however large the
   * open tail already is.
   */
  @Test
  void singleRowAppendsIntoLargeOpenTail() {
    ColumnStore store = store(65536);
    store.createTable(TableSchema.builder("t")
        .column(ColumnDefinition.integer("n"))
        .column(ColumnDefinition.string("tag"))
        .build());

    Assertions.assertTimeoutPreemptively(Duration.ofSeconds(20), () -> {
      for (int i = 0; i < 50_000; i++) {
        store.append("t", RowBatch.builder("n", "tag").row(i, "t" + (i % 8)).build());
      }
    }, "Single row appends must not rebuild the open tail");

    TableSnapshot snapshot = store.snapshot("t");
    Assertions.assertEquals(50_000, snapshot.rowCount());
    Assertions.assertEquals(1, snapshot.segments().size());
    ColumnStatistics tags = snapshot.segments().get(0).statistics("tag");
    Assertions.assertEquals(8, tags.distinctValues().size());
    List<Object> last = new ArrayList<>();
    store.readColumn("t", "n", RowRange.of(49_998, 2)).forEachRemaining(last::add);
    Assertions.assertEquals(List.of(49_998L, 49_999L), last);
  }

  /**
   * Sealing the open tail encodes exactly the rows it buffered.
   */
  @Test
  void sealedTailMatchesBufferedRows() {
    ColumnStore store = store(4);
    store.createTable(TableSchema.builder("t").column(ColumnDefinition.string("s")).build());
    for (int i = 0; i < 6; i++) {
      store.append("t", RowBatch.builder("s").row("v" + i).build());
    }

    List<Segment> segments = store.snapshot("t").segments();
    Assertions.assertTrue(segments.get(0).isSealed());
    Assertions.assertEquals(Encoding.DICTIONARY, segments.get(0).chunk("s").encoding());
    Assertions.assertEquals(2, segments.get(1).rowCount());
    List<Object> values = new ArrayList<>();
    store.readColumn("t", "s", RowRange.of(0, 6)).forEachRemaining(values::add);
    Assertions.assertEquals(List.of("v0", "v1", "v2", "v3", "v4", "v5"), values);
  }
}
