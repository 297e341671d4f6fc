package se.alipsa.jcolumnar.plan;

import java.util.List;
import java.util.Objects;
import se.alipsa.jcolumnar.aggregate.AggregateSpec;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.window.WindowFunctionCall;

/**
 * Operator of a logical plan. Each operator is an immutable record; all but
 * {@link Scan} have exactly one input.
 */
public interface PlanNode {

  /**
   * The input operator.
   *
   * @return the input or {@code null} for a scan
   */
  PlanNode input();

  /**
   * Stage name used in error reports.
   *
   * @return the stage
   */
  String stage();

  /**
   * Read columns of a table.
   *
   * @param table
   *          the table name
   * @param columns
   *          the columns to read; empty reads all columns
   */
  record Scan(String table, List<String> columns) implements PlanNode {
    public Scan {
      Objects.requireNonNull(table, "table");
      columns = columns == null ? List.of() : List.copyOf(columns);
    }

    @Override
    public PlanNode input() {
      return null;
    }

    @Override
    public String stage() {
      return "scan";
    }
  }

  /**
   * Keep rows for which a predicate is TRUE.
   *
   * @param input
   *          the input
   * @param predicate
   *          the condition
   */
  record Filter(PlanNode input, Predicate predicate) implements PlanNode {
    public Filter {
      Objects.requireNonNull(input, "input");
      Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public String stage() {
      return "filter";
    }
  }

  /**
   * Grouped aggregation, producing the key columns followed by the aggregates.
   *
   * @param input
   *          the input
   * @param keys
   *          grouping columns, empty for one global group
   * @param aggregates
   *          aggregates to compute
   * @param having
   *          condition over keys and aggregate aliases, may be {@code null}
   */
  record GroupBy(PlanNode input, List<String> keys, List<AggregateSpec> aggregates, Predicate having)
      implements PlanNode {
    public GroupBy {
      Objects.requireNonNull(input, "input");
      keys = keys == null ? List.of() : List.copyOf(keys);
      aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
    }

    @Override
    public String stage() {
      return "group-by";
    }
  }

  /**
   * Append one column per window call to the input rows.
   *
   * @param input
   *          the input
   * @param calls
   *          the window calls
   */
  record Window(PlanNode input, List<WindowFunctionCall> calls) implements PlanNode {
    public Window {
      Objects.requireNonNull(input, "input");
      calls = List.copyOf(calls);
    }

    @Override
    public String stage() {
      return "window";
    }
  }

  /**
   * Stable multi-key sort.
   *
   * @param input
   *          the input
   * @param keys
   *          the sort keys
   */
  record Sort(PlanNode input, List<SortKey> keys) implements PlanNode {
    public Sort {
      Objects.requireNonNull(input, "input");
      keys = List.copyOf(keys);
    }

    @Override
    public String stage() {
      return "sort";
    }
  }

  /**
   * Skip {@code offset} rows, then keep at most {@code count}.
   *
   * @param input
   *          the input
   * @param count
   *          maximum number of rows
   * @param offset
   *          rows to skip
   */
  record Limit(PlanNode input, long count, long offset) implements PlanNode {
    public Limit {
      Objects.requireNonNull(input, "input");
    }

    @Override
    public String stage() {
      return "limit";
    }
  }

  /**
   * Select and rename columns.
   *
   * @param input
   *          the input
   * @param items
   *          the output columns
   */
  record Project(PlanNode input, List<ProjectItem> items) implements PlanNode {
    public Project {
      Objects.requireNonNull(input, "input");
      items = List.copyOf(items);
    }

    @Override
    public String stage() {
      return "project";
    }
  }
}
