package se.alipsa.jcolumnar;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.exec.QueryContext;
import se.alipsa.jcolumnar.exec.QueryExecutor;
import se.alipsa.jcolumnar.exec.QueryResult;
import se.alipsa.jcolumnar.plan.PlanNode;
import se.alipsa.jcolumnar.segment.SegmentManager;
import se.alipsa.jcolumnar.sql.SqlPlanner;
import se.alipsa.jcolumnar.store.ColumnCursor;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.RowBatch;
import se.alipsa.jcolumnar.store.RowRange;
import se.alipsa.jcolumnar.store.TableSchema;

/**
 * Entry point tying the column store, segment manager, executor and SQL
 * planner together. Each engine owns its tables and its worker pool; close it
 * to release the workers.
 */
public class ColumnarEngine implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ColumnarEngine.class);

  private final EngineConfig config;
  private final ColumnStore store;
  private final SegmentManager segmentManager;
  private final ExecutorService workers;
  private final QueryExecutor executor;
  private final SqlPlanner planner;

  /**
   * Create an engine configured from {@code jcolumnar.properties} and system
   * properties.
   */
  public ColumnarEngine() {
    this(EngineConfig.load());
  }

  /**
   * Create an engine.
   *
   * @param config
   *          the configuration
   */
  public ColumnarEngine(EngineConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.store = new ColumnStore(config);
    this.segmentManager = new SegmentManager(store);
    this.workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
    this.executor = new QueryExecutor(store, segmentManager, workers, config);
    this.planner = new SqlPlanner(store);
    log.debug("Started engine with {} worker threads", config.workerThreads());
  }

  public void createTable(TableSchema schema) {
    store.createTable(schema);
  }

  /**
   * Append rows to a table.
   *
   * @param table
   *          the table name
   * @param batch
   *          the rows
   * @return the row positions assigned to the batch
   */
  public RowRange append(String table, RowBatch batch) {
    return store.append(table, batch);
  }

  public ColumnCursor readColumn(String table, String column, RowRange range) {
    return store.readColumn(table, column, range);
  }

  public QueryResult execute(PlanNode plan) {
    return executor.execute(plan);
  }

  public QueryResult execute(PlanNode plan, QueryContext context) {
    return executor.execute(plan, context);
  }

  /**
   * Translate an SQL SELECT without running it.
   *
   * @param sql
   *          the query
   * @return the logical plan
   */
  public PlanNode plan(String sql) {
    return planner.plan(sql);
  }

  /**
   * Plan and run an SQL SELECT.
   *
   * @param sql
   *          the query
   * @return the result
   */
  public QueryResult query(String sql) {
    return execute(plan(sql));
  }

  public QueryResult query(String sql, QueryContext context) {
    return execute(plan(sql), context);
  }

  public ColumnStore store() {
    return store;
  }

  public SegmentManager segmentManager() {
    return segmentManager;
  }

  public EngineConfig config() {
    return config;
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Worker threads did not finish within 10 seconds, interrupting");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable task) {
      Thread thread = new Thread(task, "jcolumnar-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
