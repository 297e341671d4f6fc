package se.alipsa.jcolumnar.aggregate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.error.TaskFailures;
import se.alipsa.jcolumnar.predicate.BatchView;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.predicate.PredicateEvaluator;
import se.alipsa.jcolumnar.predicate.SelectionVector;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Hash based grouped aggregation.
 *
 * <p>
 * Rows are folded into one accumulator set per distinct group key in a single
 * pass. Groups are returned in the order their key was first seen. Without
 * grouping columns exactly one global group is produced, even for empty input.
 * </p>
 *
 * <p>
 * When an executor is supplied and the input has at least
 * {@code parallelThreshold} rows, the rows are split into contiguous chunks
 * that are aggregated into private partial tables on worker threads. The
 * partial tables are then merged on the calling thread in chunk order, which
 * keeps the first-seen group order of a sequential run.
 * </p>
 */
public class GroupByAggregator {

  private static final Logger log = LoggerFactory.getLogger(GroupByAggregator.class);

  static final String STAGE = "group-by";

  private final ExecutorService executor;
  private final int workers;
  private final int parallelThreshold;
  private final String table;

  /**
   * Create a sequential aggregator.
   *
   * @param table
   *          the table used in error reports, may be {@code null}
   */
  public GroupByAggregator(String table) {
    this(null, 1, Integer.MAX_VALUE, table);
  }

  /**
   * Create an aggregator that may use worker threads.
   *
   * @param executor
   *          the worker pool, {@code null} for sequential aggregation
   * @param workers
   *          number of chunks to split large inputs into
   * @param parallelThreshold
   *          smallest input size aggregated in parallel
   * @param table
   *          the table used in error reports, may be {@code null}
   */
  public GroupByAggregator(ExecutorService executor, int workers, int parallelThreshold, String table) {
    this.executor = executor;
    this.workers = Math.max(1, workers);
    this.parallelThreshold = parallelThreshold;
    this.table = table;
  }

  /**
   * Aggregate rows.
   *
   * @param rows
   *          the input rows
   * @param groupBy
   *          grouping column names, may be empty
   * @param specs
   *          the aggregates to compute
   * @return one result per group in first-seen order
   * @throws PlanException
   *           if a column is unknown or an aggregate does not accept its
   *           argument type
   */
  public List<GroupResult> aggregate(BatchView rows, List<String> groupBy, List<AggregateSpec> specs) {
    int[] keyColumns = new int[groupBy.size()];
    for (int i = 0; i < keyColumns.length; i++) {
      keyColumns[i] = resolve(rows, groupBy.get(i));
    }
    int[] argumentColumns = new int[specs.size()];
    DataType[] argumentTypes = new DataType[specs.size()];
    for (int i = 0; i < specs.size(); i++) {
      AggregateSpec spec = specs.get(i);
      if (spec.isCountStar()) {
        argumentColumns[i] = -1;
        continue;
      }
      argumentColumns[i] = resolve(rows, spec.column());
      argumentTypes[i] = rows.columnType(argumentColumns[i]);
      if (argumentTypes[i] != null && !spec.function().accepts(argumentTypes[i])) {
        throw new PlanException(STAGE, table, spec.column(),
            spec.function() + " does not accept " + argumentTypes[i] + " arguments");
      }
    }
    int rowCount = rows.rowCount();
    GroupTable result;
    if (executor != null && workers > 1 && rowCount >= parallelThreshold) {
      result = aggregateParallel(rows, keyColumns, argumentColumns, specs, argumentTypes);
    } else {
      result = new GroupTable(keyColumns, argumentColumns, specs, argumentTypes, STAGE);
      result.addRows(rows, 0, rowCount);
    }
    if (keyColumns.length == 0) {
      result.ensureGlobalGroup();
    }
    if (log.isDebugEnabled()) {
      log.debug("Aggregated {} rows into {} groups", rowCount, result.size());
    }
    return result.results();
  }

  private GroupTable aggregateParallel(BatchView rows, int[] keyColumns, int[] argumentColumns,
      List<AggregateSpec> specs, DataType[] argumentTypes) {
    int rowCount = rows.rowCount();
    int chunkSize = (rowCount + workers - 1) / workers;
    List<Future<GroupTable>> futures = new ArrayList<>();
    for (int from = 0; from < rowCount; from += chunkSize) {
      int start = from;
      int end = Math.min(rowCount, from + chunkSize);
      futures.add(executor.submit(() -> {
        GroupTable partial = new GroupTable(keyColumns, argumentColumns, specs, argumentTypes, STAGE);
        partial.addRows(rows, start, end);
        return partial;
      }));
    }
    GroupTable merged = null;
    try {
      for (Future<GroupTable> future : futures) {
        GroupTable partial = future.get();
        if (merged == null) {
          merged = partial;
        } else {
          merged.merge(partial);
        }
      }
    } catch (ExecutionException e) {
      cancelAll(futures);
      throw TaskFailures.unwrap(e, STAGE, table);
    } catch (InterruptedException e) {
      cancelAll(futures);
      throw TaskFailures.interrupted(e, STAGE, table);
    }
    log.debug("Merged {} partial group tables", futures.size());
    return merged == null ? new GroupTable(keyColumns, argumentColumns, specs, argumentTypes, STAGE) : merged;
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> future : futures) {
      future.cancel(true);
    }
  }

  /**
   * Keep the groups satisfying a HAVING predicate.
   *
   * @param results
   *          the finalized groups
   * @param groupBy
   *          grouping column names, referenced by the predicate as is
   * @param specs
   *          the aggregates, referenced by the predicate through their alias
   * @param keyTypes
   *          types of the grouping columns
   * @param aggregateTypes
   *          result types of the aggregates
   * @param having
   *          the predicate, {@code null} keeps all groups
   * @return the surviving groups in input order
   */
  public List<GroupResult> having(List<GroupResult> results, List<String> groupBy, List<AggregateSpec> specs,
      List<DataType> keyTypes, List<DataType> aggregateTypes, Predicate having) {
    if (having == null) {
      return results;
    }
    List<String> names = new ArrayList<>(groupBy);
    List<DataType> types = new ArrayList<>(keyTypes);
    for (AggregateSpec spec : specs) {
      names.add(spec.alias());
    }
    types.addAll(aggregateTypes);
    BatchView view = new GroupResultView(results, names, types);
    SelectionVector selection = new PredicateEvaluator("having", table).evaluate(having, view);
    List<GroupResult> kept = new ArrayList<>(selection.count());
    for (int idx : selection.indices()) {
      kept.add(results.get(idx));
    }
    return kept;
  }

  private int resolve(BatchView rows, String column) {
    int idx = rows.columnIndex(column);
    if (idx < 0) {
      throw new PlanException(STAGE, table, column, "Unknown column");
    }
    return idx;
  }

  private record GroupResultView(List<GroupResult> results, List<String> names, List<DataType> types)
      implements BatchView {

    @Override
    public int rowCount() {
      return results.size();
    }

    @Override
    public int columnIndex(String name) {
      for (int i = 0; i < names.size(); i++) {
        if (names.get(i).equalsIgnoreCase(name)) {
          return i;
        }
      }
      return -1;
    }

    @Override
    public DataType columnType(int column) {
      return types.get(column);
    }

    @Override
    public Object value(int column, int row) {
      GroupResult result = results.get(row);
      int keys = result.keys().size();
      return column < keys ? result.keys().get(column) : result.aggregates().get(column - keys);
    }
  }
}
