package se.alipsa.jcolumnar.exec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.error.PruneInconsistencyException;
import se.alipsa.jcolumnar.error.TaskFailures;
import se.alipsa.jcolumnar.plan.ResultColumn;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.predicate.PredicateEvaluator;
import se.alipsa.jcolumnar.predicate.SelectionVector;
import se.alipsa.jcolumnar.segment.Segment;
import se.alipsa.jcolumnar.segment.SegmentManager;

/**
 * Reads the segments of a table that may satisfy a pushed down filter and
 * materializes the requested columns of the matching rows in row order.
 */
final class ScanOperator {

  private static final Logger log = LoggerFactory.getLogger(ScanOperator.class);

  private static final String STAGE = "scan";

  private final SegmentManager segmentManager;
  private final ExecutorService executor;
  private final boolean verifyPruning;

  ScanOperator(SegmentManager segmentManager, ExecutorService executor, boolean verifyPruning) {
    this.segmentManager = segmentManager;
    this.executor = executor;
    this.verifyPruning = verifyPruning;
  }

  RowSet scan(String table, List<ResultColumn> columns, Predicate filter, QueryContext context) {
    List<Segment> segments = segmentManager.segments(table);
    List<Segment> kept = segmentManager.prune(segments, filter);
    Set<Integer> keptIds = new HashSet<>();
    for (Segment segment : kept) {
      keptIds.add(segment.id());
    }
    List<Segment> pruned = new ArrayList<>();
    for (Segment segment : segments) {
      if (keptIds.contains(segment.id())) {
        context.accessListener().segmentScanned(table, segment.id());
      } else {
        pruned.add(segment);
        context.accessListener().segmentPruned(table, segment.id());
      }
    }
    if (verifyPruning && filter != null) {
      verify(table, pruned, filter);
    }
    List<Object[]> rows = new ArrayList<>();
    if (executor == null || kept.size() < 2) {
      for (Segment segment : kept) {
        context.cancellation().throwIfCancelled(STAGE);
        rows.addAll(readSegment(table, segment, columns, filter));
      }
    } else {
      rows.addAll(readParallel(table, kept, columns, filter, context.cancellation()));
    }
    if (log.isDebugEnabled()) {
      log.debug("Scan of {} read {} of {} segments, {} rows", table, kept.size(), segments.size(), rows.size());
    }
    return new RowSet(columns, rows);
  }

  private List<Object[]> readParallel(String table, List<Segment> segments, List<ResultColumn> columns,
      Predicate filter, CancellationToken token) {
    List<Future<List<Object[]>>> futures = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      futures.add(executor.submit(() -> {
        token.throwIfCancelled(STAGE);
        return readSegment(table, segment, columns, filter);
      }));
    }
    List<Object[]> rows = new ArrayList<>();
    try {
      // stitch in segment order
      for (Future<List<Object[]>> future : futures) {
        rows.addAll(future.get());
      }
    } catch (ExecutionException e) {
      cancelAll(futures);
      if (e.getCause() instanceof QueryCancelledException cancelled) {
        throw cancelled;
      }
      throw TaskFailures.unwrap(e, STAGE, table);
    } catch (InterruptedException e) {
      cancelAll(futures);
      throw TaskFailures.interrupted(e, STAGE, table);
    }
    return rows;
  }

  private static List<Object[]> readSegment(String table, Segment segment, List<ResultColumn> columns,
      Predicate filter) {
    SegmentBatch batch = new SegmentBatch(segment);
    int[] idx = new int[columns.size()];
    for (int i = 0; i < idx.length; i++) {
      idx[i] = batch.columnIndex(columns.get(i).name());
    }
    int[] selected;
    if (filter == null) {
      selected = SelectionVector.all(batch.rowCount()).indices();
    } else {
      selected = new PredicateEvaluator("filter", table).evaluate(filter, batch).indices();
    }
    List<Object[]> rows = new ArrayList<>(selected.length);
    for (int row : selected) {
      Object[] values = new Object[idx.length];
      for (int c = 0; c < idx.length; c++) {
        values[c] = batch.value(idx[c], row);
      }
      rows.add(values);
    }
    return rows;
  }

  private static void verify(String table, List<Segment> pruned, Predicate filter) {
    PredicateEvaluator evaluator = new PredicateEvaluator("filter", table);
    for (Segment segment : pruned) {
      SelectionVector selection = evaluator.evaluate(filter, new SegmentBatch(segment));
      if (selection.count() > 0) {
        log.warn("Segment {} of {} was pruned but holds {} rows matching {}", segment.id(), table,
            selection.count(), filter);
        throw new PruneInconsistencyException(STAGE, table, null,
            "Pruned segment " + segment.id() + " contains " + selection.count() + " matching rows");
      }
    }
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> future : futures) {
      future.cancel(true);
    }
  }
}
