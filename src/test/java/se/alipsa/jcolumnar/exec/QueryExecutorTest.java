package se.alipsa.jcolumnar.exec;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.EngineConfig;
import se.alipsa.jcolumnar.aggregate.AggregateSpec;
import se.alipsa.jcolumnar.error.ErrorKind;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.error.PruneInconsistencyException;
import se.alipsa.jcolumnar.plan.PlanBuilder;
import se.alipsa.jcolumnar.plan.PlanNode;
import se.alipsa.jcolumnar.plan.ProjectItem;
import se.alipsa.jcolumnar.plan.ResultColumn;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.predicate.Predicates;
import se.alipsa.jcolumnar.segment.SegmentAccessListener;
import se.alipsa.jcolumnar.segment.SegmentManager;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.RowBatch;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.window.WindowFunctionCall;
import se.alipsa.jcolumnar.window.WindowFunctionType;
import se.alipsa.jcolumnar.window.WindowSpec;

/**
 * Tests for running logical plans against a populated store.
 */
class QueryExecutorTest {

  private static final String[] REGIONS = {"north", "south", "east"};

  private EngineConfig config;
  private ColumnStore store;
  private SegmentManager segmentManager;
  private ExecutorService workers;
  private QueryExecutor executor;

  @BeforeEach
  void setUp() {
    config = EngineConfig.defaults().toBuilder().segmentCapacity(5).workerThreads(4).parallelThreshold(4).build();
    store = new ColumnStore(config);
    store.createTable(TableSchema.builder("sales")
        .column(ColumnDefinition.integer("id").notNull())
        .column(ColumnDefinition.string("region"))
        .column(ColumnDefinition.decimal("amount", 2))
        .column(ColumnDefinition.date("day"))
        .build());
    RowBatch.Builder batch = RowBatch.builder("id", "region", "amount", "day");
    for (int i = 0; i < 12; i++) {
      batch.row(i, REGIONS[i % 3], new BigDecimal((i + 1) + ".00"), LocalDate.of(2024, 1, 1).plusDays(i));
    }
    store.append("sales", batch.build());
    segmentManager = new SegmentManager(store);
    workers = Executors.newFixedThreadPool(4);
    executor = new QueryExecutor(store, segmentManager, workers, config);
  }

  @AfterEach
  void tearDown() {
    workers.shutdownNow();
  }

  @Test
  void filterSortLimitProject() {
    PlanNode plan = PlanBuilder.scan("sales")
        .filter(Predicates.ge("id", 3))
        .sort(SortKey.desc("id"))
        .limit(3, 1)
        .project(List.of(ProjectItem.of("id", "sale_id"), ProjectItem.of("region")))
        .build();

    QueryResult result = executor.execute(plan);

    Assertions.assertEquals(QueryOutcome.COMPLETED, result.outcome());
    Assertions.assertTrue(result.ordered(), "A sorted plan reports ordered output");
    Assertions.assertEquals(List.of(new ResultColumn("sale_id", DataType.INTEGER),
        new ResultColumn("region", DataType.STRING)), result.columns());
    Assertions.assertEquals(List.of(10L, 9L, 8L), result.column("sale_id"));
    Assertions.assertEquals("east", result.rows().get(1).get("REGION"));
  }

  /**
   * Without a sort the rows still come back in segment order, but the result
   * does not claim an ordering.
   */
  @Test
  void scanKeepsSegmentOrder() {
    QueryResult result = executor.execute(PlanBuilder.scan("sales", "id").build());
    List<Object> expected = new ArrayList<>();
    for (long i = 0; i < 12; i++) {
      expected.add(i);
    }
    Assertions.assertEquals(expected, result.column("id"));
    Assertions.assertFalse(result.ordered());
  }

  @Test
  void groupByWithHavingAndSort() {
    PlanNode plan = PlanBuilder.scan("sales")
        .groupBy(List.of("region"), List.of(AggregateSpec.sum("amount", "total"), AggregateSpec.countStar("n")),
            Predicates.gt("total", 23))
        .sort(SortKey.desc("total"))
        .build();

    QueryResult result = executor.execute(plan);

    Assertions.assertEquals(List.of("east", "south"), result.column("region"));
    Assertions.assertEquals(List.of(new BigDecimal("30.00"), new BigDecimal("26.00")), result.column("total"));
    Assertions.assertEquals(List.of(4L, 4L), result.column("n"));
  }

  @Test
  void windowRunsOverFilteredRows() {
    WindowSpec byId = WindowSpec.orderBy(SortKey.asc("id")).partitionBy("region");
    PlanNode plan = PlanBuilder.scan("sales", "id", "region")
        .filter(Predicates.eq("region", "north"))
        .window(WindowFunctionCall.rowNumber(byId, "rn"),
            WindowFunctionCall.aggregate(WindowFunctionType.COUNT, null, byId, "seen"))
        .build();

    QueryResult result = executor.execute(plan);

    Assertions.assertEquals(List.of(0L, 3L, 6L, 9L), result.column("id"));
    Assertions.assertEquals(List.of(1L, 2L, 3L, 4L), result.column("rn"));
    Assertions.assertEquals(List.of(1L, 2L, 3L, 4L), result.column("seen"));
    Assertions.assertEquals(DataType.INTEGER, result.columns().get(2).type());
  }

  /**
   * Segments whose statistics exclude the filter are reported as pruned and
   * never scanned.
   */
  @Test
  void prunedSegmentsAreReported() {
    SegmentAccessListener listener = mock(SegmentAccessListener.class);
    PlanNode plan = PlanBuilder.scan("sales", "id").filter(Predicates.between("id", 0, 2)).build();

    QueryResult result = executor.execute(plan, QueryContext.create().withAccessListener(listener));

    Assertions.assertEquals(List.of(0L, 1L, 2L), result.column("id"));
    verify(listener).segmentScanned("sales", 0);
    verify(listener).segmentPruned("sales", 1);
    verify(listener, never()).segmentScanned("sales", 1);
  }

  @Test
  void cancelledBeforeStartReturnsNoRows() {
    CancellationToken token = new CancellationToken();
    token.cancel();

    QueryResult result = executor.execute(PlanBuilder.scan("sales", "id", "day").build(),
        QueryContext.create().withCancellation(token));

    Assertions.assertEquals(QueryOutcome.CANCELLED, result.outcome());
    Assertions.assertEquals(0, result.size());
    Assertions.assertEquals(List.of(new ResultColumn("id", DataType.INTEGER), new ResultColumn("day", DataType.DATE)),
        result.columns(), "A cancelled result still describes its columns");
  }

  /**
   * Cancelling while the scan is under way stops before the next segment is
   * read.
   */
  @Test
  void cancelledDuringScan() {
    CancellationToken token = new CancellationToken();
    SegmentAccessListener cancelOnFirstSegment = new SegmentAccessListener() {
      @Override
      public void segmentScanned(String table, int segmentId) {
        token.cancel();
      }

      @Override
      public void segmentPruned(String table, int segmentId) {
        // not needed
      }
    };
    QueryExecutor sequential = new QueryExecutor(store, segmentManager, null, config);

    QueryResult result = sequential.execute(PlanBuilder.scan("sales").build(),
        new QueryContext(token, cancelOnFirstSegment));

    Assertions.assertEquals(QueryOutcome.CANCELLED, result.outcome());
    Assertions.assertTrue(result.rows().isEmpty());
  }

  /**
   * With pruning verification on, a segment wrongly pruned while holding
   * matching rows fails the query.
   */
  @Test
  void verifyPruningDetectsWronglyPrunedSegments() {
    SegmentManager broken = mock(SegmentManager.class);
    when(broken.segments("sales")).thenReturn(segmentManager.segments("sales"));
    when(broken.prune(anyList(), any())).thenReturn(List.of());
    PlanNode plan = PlanBuilder.scan("sales", "id").filter(Predicates.eq("id", 7)).build();

    QueryExecutor checking = new QueryExecutor(store, broken, workers,
        config.toBuilder().verifyPruning(true).build());
    PruneInconsistencyException e = Assertions.assertThrows(PruneInconsistencyException.class,
        () -> checking.execute(plan));
    Assertions.assertEquals(ErrorKind.PRUNE_INCONSISTENCY, e.kind());
    Assertions.assertEquals("sales", e.table());

    QueryExecutor trusting = new QueryExecutor(store, broken, workers, config);
    Assertions.assertEquals(0, trusting.execute(plan).size(), "Without verification the pruning is trusted");
  }

  @Test
  void readerEndsWithEndOfStream() {
    QueryResult result = executor.execute(PlanBuilder.scan("sales", "id").filter(Predicates.lt("id", 2)).build());
    ResultReader reader = result.reader();

    Assertions.assertEquals(0L, reader.read().get("id"));
    Assertions.assertEquals(1L, reader.read().get(0));
    Assertions.assertTrue(reader.read().isEndOfStream());
    Assertions.assertSame(ResultRow.END_OF_STREAM, reader.read(), "Reading past the end keeps signalling the end");
  }

  @Test
  void invalidPlansFailBeforeExecution() {
    PlanException e = Assertions.assertThrows(PlanException.class,
        () -> executor.execute(PlanBuilder.scan("sales").sort(SortKey.asc("price")).build()));
    Assertions.assertEquals("sort", e.stage());
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> executor.execute(PlanBuilder.scan("sales", "id").build()).rows().get(0).get("region"));
  }
}
