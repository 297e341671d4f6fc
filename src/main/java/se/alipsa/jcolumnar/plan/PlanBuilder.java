package se.alipsa.jcolumnar.plan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import se.alipsa.jcolumnar.aggregate.AggregateSpec;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.window.WindowFunctionCall;

/**
 * Fluent construction of a logical plan, bottom up.
 *
 * <pre>
 * PlanNode plan = PlanBuilder.scan("readings")
 *     .filter(Predicates.between("day", "2024-06-01", "2024-06-30"))
 *     .window(WindowFunctionCall.rowNumber(WindowSpec.orderBy(SortKey.asc("day")), "rn"))
 *     .sort(SortKey.asc("day"))
 *     .limit(10)
 *     .build();
 * </pre>
 */
public final class PlanBuilder {

  private PlanNode current;

  private PlanBuilder(PlanNode root) {
    this.current = root;
  }

  /**
   * Start with a scan.
   *
   * @param table
   *          the table
   * @param columns
   *          columns to read; none reads all
   * @return the builder
   */
  public static PlanBuilder scan(String table, String... columns) {
    return new PlanBuilder(new PlanNode.Scan(table, Arrays.asList(columns)));
  }

  /**
   * Continue from an existing plan.
   *
   * @param plan
   *          the plan to extend
   * @return the builder
   */
  public static PlanBuilder from(PlanNode plan) {
    return new PlanBuilder(plan);
  }

  public PlanBuilder filter(Predicate predicate) {
    current = new PlanNode.Filter(current, predicate);
    return this;
  }

  public PlanBuilder groupBy(List<String> keys, List<AggregateSpec> aggregates) {
    return groupBy(keys, aggregates, null);
  }

  public PlanBuilder groupBy(List<String> keys, List<AggregateSpec> aggregates, Predicate having) {
    current = new PlanNode.GroupBy(current, keys, aggregates, having);
    return this;
  }

  /**
   * Aggregate without grouping columns.
   *
   * @param aggregates
   *          the aggregates
   * @return the builder
   */
  public PlanBuilder aggregate(AggregateSpec... aggregates) {
    current = new PlanNode.GroupBy(current, List.of(), Arrays.asList(aggregates), null);
    return this;
  }

  public PlanBuilder window(WindowFunctionCall... calls) {
    current = new PlanNode.Window(current, Arrays.asList(calls));
    return this;
  }

  public PlanBuilder window(List<WindowFunctionCall> calls) {
    current = new PlanNode.Window(current, calls);
    return this;
  }

  public PlanBuilder sort(SortKey... keys) {
    current = new PlanNode.Sort(current, Arrays.asList(keys));
    return this;
  }

  public PlanBuilder sort(List<SortKey> keys) {
    current = new PlanNode.Sort(current, keys);
    return this;
  }

  public PlanBuilder limit(long count) {
    current = new PlanNode.Limit(current, count, 0);
    return this;
  }

  public PlanBuilder limit(long count, long offset) {
    current = new PlanNode.Limit(current, count, offset);
    return this;
  }

  /**
   * Project columns by name.
   *
   * @param columns
   *          output columns, keeping their names
   * @return the builder
   */
  public PlanBuilder project(String... columns) {
    List<ProjectItem> items = new ArrayList<>(columns.length);
    for (String column : columns) {
      items.add(ProjectItem.of(column));
    }
    current = new PlanNode.Project(current, items);
    return this;
  }

  public PlanBuilder project(List<ProjectItem> items) {
    current = new PlanNode.Project(current, items);
    return this;
  }

  public PlanNode build() {
    return current;
  }
}
