package se.alipsa.jcolumnar.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.EngineConfig;
import se.alipsa.jcolumnar.aggregate.AggregateSpec;
import se.alipsa.jcolumnar.aggregate.GroupByAggregator;
import se.alipsa.jcolumnar.aggregate.GroupResult;
import se.alipsa.jcolumnar.error.ColumnarException;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.plan.PlanNode;
import se.alipsa.jcolumnar.plan.PlanValidator;
import se.alipsa.jcolumnar.plan.ResultColumn;
import se.alipsa.jcolumnar.predicate.PredicateEvaluator;
import se.alipsa.jcolumnar.segment.SegmentManager;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.window.WindowEngine;

/**
 * Runs validated logical plans against a column store.
 *
 * <p>
 * A plan is validated completely before anything executes. A Filter directly
 * above a Scan is pushed into the scan so that segment statistics can prune.
 * Cancellation is cooperative: the token is checked between segments and
 * window partitions, and a cancelled query returns an empty result with
 * outcome {@link QueryOutcome#CANCELLED} instead of failing.
 * </p>
 */
public class QueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

  private final ExecutorService executor;
  private final EngineConfig config;
  private final PlanValidator validator;
  private final ScanOperator scanOperator;

  /**
   * Create an executor.
   *
   * @param store
   *          the column store
   * @param segmentManager
   *          the segment manager of the store
   * @param executor
   *          the worker pool, {@code null} to run on the calling thread
   * @param config
   *          the engine configuration
   */
  public QueryExecutor(ColumnStore store, SegmentManager segmentManager, ExecutorService executor,
      EngineConfig config) {
    Objects.requireNonNull(store, "store");
    this.executor = executor;
    this.config = Objects.requireNonNull(config, "config");
    this.validator = new PlanValidator(store);
    this.scanOperator = new ScanOperator(segmentManager, executor, config.verifyPruning());
  }

  /**
   * Execute a plan with a default context.
   *
   * @param plan
   *          the root operator
   * @return the result
   */
  public QueryResult execute(PlanNode plan) {
    return execute(plan, QueryContext.create());
  }

  /**
   * Execute a plan.
   *
   * @param plan
   *          the root operator
   * @param context
   *          cancellation token and segment access listener
   * @return the result, empty with outcome {@link QueryOutcome#CANCELLED} if
   *         the token was cancelled before completion
   * @throws ColumnarException
   *           if the plan is invalid or execution fails
   */
  public QueryResult execute(PlanNode plan, QueryContext context) {
    List<ResultColumn> columns = validator.validate(plan);
    if (log.isDebugEnabled()) {
      log.debug("Executing {}", plan);
    }
    try {
      context.cancellation().throwIfCancelled("plan");
      RowSet rows = run(plan, context, tableOf(plan));
      return QueryResult.completed(rows, PlanValidator.isOrdered(plan));
    } catch (QueryCancelledException e) {
      log.debug("Query cancelled during {}", e.stage());
      return QueryResult.cancelled(columns);
    }
  }

  private RowSet run(PlanNode node, QueryContext context, String table) {
    try {
      return runOperator(node, context, table);
    } catch (ColumnarException | QueryCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PlanException(node.stage(), table, null, "Unexpected failure: " + e, e);
    }
  }

  private RowSet runOperator(PlanNode node, QueryContext context, String table) {
    if (node instanceof PlanNode.Scan scan) {
      return scanOperator.scan(scan.table(), validator.validate(scan), null, context);
    }
    if (node instanceof PlanNode.Filter filter) {
      if (filter.input() instanceof PlanNode.Scan scan) {
        return scanOperator.scan(scan.table(), validator.validate(scan), filter.predicate(), context);
      }
      RowSet input = run(filter.input(), context, table);
      return input.select(new PredicateEvaluator(filter.stage(), table).evaluate(filter.predicate(), input));
    }
    RowSet input = run(node.input(), context, table);
    context.cancellation().throwIfCancelled(node.stage());
    if (node instanceof PlanNode.GroupBy groupBy) {
      return groupBy(groupBy, input, table);
    }
    if (node instanceof PlanNode.Window window) {
      WindowEngine engine = new WindowEngine(executor, table);
      List<Object[]> values = engine.evaluate(input, window.calls(), context.cancellation());
      List<DataType> types = WindowEngine.resultTypes(window.calls(), name -> typeOf(input, name));
      List<ResultColumn> extra = new ArrayList<>(types.size());
      for (int i = 0; i < types.size(); i++) {
        extra.add(new ResultColumn(window.calls().get(i).alias(), types.get(i)));
      }
      return input.withColumns(extra, values);
    }
    if (node instanceof PlanNode.Sort sort) {
      return input.sort(sort.keys());
    }
    if (node instanceof PlanNode.Limit limit) {
      return input.limit(limit.count(), limit.offset());
    }
    if (node instanceof PlanNode.Project project) {
      return input.project(project.items());
    }
    throw new PlanException("plan", table, null, "Unsupported operator " + node.getClass().getSimpleName());
  }

  private RowSet groupBy(PlanNode.GroupBy groupBy, RowSet input, String table) {
    GroupByAggregator aggregator = new GroupByAggregator(executor, config.workerThreads(),
        config.parallelThreshold(), table);
    List<GroupResult> groups = aggregator.aggregate(input, groupBy.keys(), groupBy.aggregates());
    List<ResultColumn> columns = new ArrayList<>();
    List<DataType> keyTypes = new ArrayList<>();
    for (String key : groupBy.keys()) {
      DataType type = typeOf(input, key);
      keyTypes.add(type);
      columns.add(new ResultColumn(input.columns().get(input.columnIndex(key)).name(), type));
    }
    List<DataType> aggregateTypes = new ArrayList<>();
    for (AggregateSpec spec : groupBy.aggregates()) {
      DataType argument = spec.isCountStar() ? null : typeOf(input, spec.column());
      DataType type = spec.function().resultType(argument);
      aggregateTypes.add(type);
      columns.add(new ResultColumn(spec.alias(), type));
    }
    groups = aggregator.having(groups, groupBy.keys(), groupBy.aggregates(), keyTypes, aggregateTypes,
        groupBy.having());
    List<Object[]> rows = new ArrayList<>(groups.size());
    for (GroupResult group : groups) {
      rows.add(group.values().toArray());
    }
    return new RowSet(columns, rows);
  }

  private static DataType typeOf(RowSet rows, String column) {
    int idx = rows.columnIndex(column);
    return idx < 0 ? null : rows.columnType(idx);
  }

  private static String tableOf(PlanNode plan) {
    PlanNode node = plan;
    while (node.input() != null) {
      node = node.input();
    }
    return node instanceof PlanNode.Scan scan ? scan.table() : null;
  }
}
