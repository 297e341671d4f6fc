package se.alipsa.jcolumnar.window;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.error.TaskFailures;
import se.alipsa.jcolumnar.exec.CancellationToken;
import se.alipsa.jcolumnar.exec.QueryCancelledException;
import se.alipsa.jcolumnar.predicate.BatchView;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Evaluates window function calls over a batch of rows.
 *
 * <p>
 * Calls are grouped by PARTITION BY and ORDER BY so that each distinct
 * combination is partitioned and sorted once. Identical calls (same function,
 * argument, parameters and window) are computed once and their values shared
 * between output columns. Partitions are independent: with an executor they
 * are evaluated as separate tasks, each running to completion once started.
 * The cancellation token is checked before every partition.
 * </p>
 */
public class WindowEngine {

  private static final Logger log = LoggerFactory.getLogger(WindowEngine.class);

  static final String STAGE = "window";

  private final ExecutorService executor;
  private final String table;

  /**
   * Create an engine.
   *
   * @param executor
   *          worker pool for partitions, {@code null} to evaluate on the calling
   *          thread
   * @param table
   *          table name used in error reports, may be {@code null}
   */
  public WindowEngine(ExecutorService executor, String table) {
    this.executor = executor;
    this.table = table;
  }

  /**
   * Evaluate calls.
   *
   * @param input
   *          the rows to evaluate over
   * @param calls
   *          the window calls
   * @param token
   *          the cancellation token of the query
   * @return one value array per call, indexed by input row
   * @throws QueryCancelledException
   *           if the query was cancelled between partitions
   */
  public List<Object[]> evaluate(BatchView input, List<WindowFunctionCall> calls, CancellationToken token) {
    Function<String, DataType> types = typeLookup(input);
    for (WindowFunctionCall call : calls) {
      call.validate(types);
    }
    int rows = input.rowCount();
    Map<WindowFunctionCall.ComputationKey, Object[]> computed = new LinkedHashMap<>();
    Map<WindowSpec.PartitionKey, List<WindowFunctionCall>> builds = new LinkedHashMap<>();
    List<Object[]> results = new ArrayList<>(calls.size());
    for (WindowFunctionCall call : calls) {
      Object[] values = computed.get(call.computationKey());
      if (values == null) {
        values = new Object[rows];
        computed.put(call.computationKey(), values);
        builds.computeIfAbsent(call.window().partitionKey(), k -> new ArrayList<>()).add(call);
      }
      results.add(values);
    }
    for (Map.Entry<WindowSpec.PartitionKey, List<WindowFunctionCall>> build : builds.entrySet()) {
      WindowSpec.PartitionKey key = build.getKey();
      List<WindowPartition> partitions = WindowPartitioner.partition(input, key.partitionBy(), key.orderBy());
      if (log.isDebugEnabled()) {
        log.debug("Window build PARTITION BY {} ORDER BY {}: {} partitions for {} calls", key.partitionBy(),
            key.orderBy(), partitions.size(), build.getValue().size());
      }
      List<PreparedCall> prepared = new ArrayList<>(build.getValue().size());
      for (WindowFunctionCall call : build.getValue()) {
        prepared.add(prepare(call, input, computed.get(call.computationKey())));
      }
      evaluatePartitions(partitions, prepared, token);
    }
    return results;
  }

  /**
   * Result types of the calls.
   *
   * @param calls
   *          the calls
   * @param types
   *          type lookup of the input columns
   * @return one type per call
   */
  public static List<DataType> resultTypes(List<WindowFunctionCall> calls, Function<String, DataType> types) {
    List<DataType> result = new ArrayList<>(calls.size());
    for (WindowFunctionCall call : calls) {
      DataType argument = call.argument() == null ? null : types.apply(call.argument());
      result.add(call.function().resultType(argument));
    }
    return result;
  }

  private void evaluatePartitions(List<WindowPartition> partitions, List<PreparedCall> calls,
      CancellationToken token) {
    if (executor == null || partitions.size() < 2) {
      for (WindowPartition partition : partitions) {
        token.throwIfCancelled(STAGE);
        evaluatePartition(partition, calls);
      }
      return;
    }
    List<Future<?>> futures = new ArrayList<>(partitions.size());
    for (WindowPartition partition : partitions) {
      futures.add(executor.submit(() -> {
        token.throwIfCancelled(STAGE);
        evaluatePartition(partition, calls);
      }));
    }
    try {
      for (Future<?> future : futures) {
        future.get();
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
  }

  private static void cancelAll(List<Future<?>> futures) {
    for (Future<?> future : futures) {
      future.cancel(false);
    }
  }

  private static void evaluatePartition(WindowPartition partition, List<PreparedCall> calls) {
    for (PreparedCall prepared : calls) {
      WindowFunctionCall call = prepared.call();
      WindowFunctionType type = call.function();
      if (type.isRanking()) {
        RankingFunctions.evaluate(call, partition, prepared.out());
      } else if (type.isOffset()) {
        OffsetFunctions.evaluate(call, partition, prepared.argument(), call.defaultValue(), prepared.out());
      } else {
        FrameAggregator.evaluate(call, partition, call.window().effectiveFrame(), prepared.argument(),
            prepared.argumentType(), prepared.out());
      }
    }
  }

  private static PreparedCall prepare(WindowFunctionCall call, BatchView input, Object[] out) {
    if (call.argument() == null) {
      return new PreparedCall(call, null, null, out);
    }
    int column = input.columnIndex(call.argument());
    Object[] argument = new Object[input.rowCount()];
    for (int row = 0; row < argument.length; row++) {
      argument[row] = input.value(column, row);
    }
    return new PreparedCall(call, argument, input.columnType(column), out);
  }

  private static Function<String, DataType> typeLookup(BatchView input) {
    return name -> {
      int idx = input.columnIndex(name);
      return idx < 0 ? null : input.columnType(idx);
    };
  }

  private record PreparedCall(WindowFunctionCall call, Object[] argument, DataType argumentType, Object[] out) {
  }
}
