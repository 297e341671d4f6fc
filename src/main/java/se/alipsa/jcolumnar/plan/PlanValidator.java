package se.alipsa.jcolumnar.plan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import se.alipsa.jcolumnar.aggregate.AggregateSpec;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.predicate.Operand;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.store.Values;
import se.alipsa.jcolumnar.window.WindowEngine;
import se.alipsa.jcolumnar.window.WindowFunctionCall;

/**
 * Checks a logical plan before execution and derives the output columns of
 * every operator. Every column reference is resolved against the output of the
 * operator's input; any problem fails with a {@link PlanException} naming the
 * operator and column, so nothing is executed for a malformed plan.
 */
public class PlanValidator {

  private final ColumnStore store;

  /**
   * Create a validator resolving tables in a store.
   *
   * @param store
   *          the column store
   */
  public PlanValidator(ColumnStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Validate a plan.
   *
   * @param plan
   *          the root operator
   * @return the output columns of the root
   * @throws PlanException
   *           if the plan is malformed
   * @throws se.alipsa.jcolumnar.error.InvalidFrameSpecException
   *           if a window frame is malformed
   */
  public List<ResultColumn> validate(PlanNode plan) {
    if (plan == null) {
      throw new PlanException("plan", null, null, "No plan given");
    }
    if (plan instanceof PlanNode.Scan scan) {
      return scan(scan);
    }
    List<ResultColumn> input = validate(plan.input());
    if (plan instanceof PlanNode.Filter filter) {
      checkPredicate(filter.predicate(), input, filter.stage());
      return input;
    }
    if (plan instanceof PlanNode.GroupBy groupBy) {
      return groupBy(groupBy, input);
    }
    if (plan instanceof PlanNode.Window window) {
      return window(window, input);
    }
    if (plan instanceof PlanNode.Sort sort) {
      if (sort.keys().isEmpty()) {
        throw new PlanException(sort.stage(), null, null, "Sort requires at least one key");
      }
      for (SortKey key : sort.keys()) {
        require(input, key.column(), sort.stage());
      }
      return input;
    }
    if (plan instanceof PlanNode.Limit limit) {
      if (limit.count() < 0 || limit.offset() < 0) {
        throw new PlanException(limit.stage(), null, null,
            "Limit and offset must not be negative: " + limit.count() + ", " + limit.offset());
      }
      return input;
    }
    if (plan instanceof PlanNode.Project project) {
      List<ResultColumn> output = new ArrayList<>(project.items().size());
      Set<String> names = new HashSet<>();
      for (ProjectItem item : project.items()) {
        ResultColumn column = require(input, item.column(), project.stage());
        if (!names.add(TableSchema.normalize(item.alias()))) {
          throw new PlanException(project.stage(), null, item.alias(), "Duplicate output column");
        }
        output.add(new ResultColumn(item.alias(), column.type()));
      }
      return output;
    }
    throw new PlanException("plan", null, null, "Unsupported operator " + plan.getClass().getSimpleName());
  }

  /**
   * Whether the output order of a plan is defined by a sort: there is a Sort
   * with only order preserving operators above it.
   *
   * @param plan
   *          the root operator
   * @return {@code true} if the row order is defined
   */
  public static boolean isOrdered(PlanNode plan) {
    PlanNode node = plan;
    while (node != null) {
      if (node instanceof PlanNode.Sort) {
        return true;
      }
      if (node instanceof PlanNode.GroupBy || node instanceof PlanNode.Scan) {
        return false;
      }
      node = node.input();
    }
    return false;
  }

  private List<ResultColumn> scan(PlanNode.Scan scan) {
    TableSchema schema = store.schema(scan.table());
    if (schema == null) {
      throw new PlanException(scan.stage(), scan.table(), null, "Unknown table");
    }
    List<ResultColumn> output = new ArrayList<>();
    if (scan.columns().isEmpty()) {
      for (ColumnDefinition def : schema.columns()) {
        output.add(new ResultColumn(def.name(), def.type()));
      }
      return output;
    }
    Set<String> seen = new HashSet<>();
    for (String column : scan.columns()) {
      ColumnDefinition def = schema.column(column);
      if (def == null) {
        throw new PlanException(scan.stage(), scan.table(), column, "Unknown column");
      }
      if (seen.add(TableSchema.normalize(column))) {
        output.add(new ResultColumn(def.name(), def.type()));
      }
    }
    return output;
  }

  private List<ResultColumn> groupBy(PlanNode.GroupBy groupBy, List<ResultColumn> input) {
    String stage = groupBy.stage();
    List<ResultColumn> output = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (String key : groupBy.keys()) {
      ResultColumn column = require(input, key, stage);
      if (!names.add(TableSchema.normalize(key))) {
        throw new PlanException(stage, null, key, "Duplicate grouping column");
      }
      output.add(column);
    }
    for (AggregateSpec spec : groupBy.aggregates()) {
      DataType argument = null;
      if (!spec.isCountStar()) {
        argument = require(input, spec.column(), stage).type();
        if (!spec.function().accepts(argument)) {
          throw new PlanException(stage, null, spec.column(), spec.function() + " does not accept " + argument);
        }
      }
      if (!names.add(TableSchema.normalize(spec.alias()))) {
        throw new PlanException(stage, null, spec.alias(), "Aggregate name collides with another output column");
      }
      output.add(new ResultColumn(spec.alias(), spec.function().resultType(argument)));
    }
    if (groupBy.having() != null) {
      checkPredicate(groupBy.having(), output, "having");
    }
    return output;
  }

  private List<ResultColumn> window(PlanNode.Window window, List<ResultColumn> input) {
    Function<String, DataType> types = name -> {
      ResultColumn column = find(input, name);
      return column == null ? null : column.type();
    };
    Set<String> names = new HashSet<>();
    for (ResultColumn column : input) {
      names.add(TableSchema.normalize(column.name()));
    }
    for (WindowFunctionCall call : window.calls()) {
      call.validate(types);
      if (!names.add(TableSchema.normalize(call.alias()))) {
        throw new PlanException(window.stage(), null, call.alias(), "Window output collides with another column");
      }
    }
    List<ResultColumn> output = new ArrayList<>(input);
    List<DataType> resultTypes = WindowEngine.resultTypes(window.calls(), types);
    for (int i = 0; i < window.calls().size(); i++) {
      output.add(new ResultColumn(window.calls().get(i).alias(), resultTypes.get(i)));
    }
    return output;
  }

  private void checkPredicate(Predicate predicate, List<ResultColumn> input, String stage) {
    if (predicate instanceof Predicate.And and) {
      checkPredicate(and.left(), input, stage);
      checkPredicate(and.right(), input, stage);
    } else if (predicate instanceof Predicate.Or or) {
      checkPredicate(or.left(), input, stage);
      checkPredicate(or.right(), input, stage);
    } else if (predicate instanceof Predicate.Not not) {
      checkPredicate(not.predicate(), input, stage);
    } else if (predicate instanceof Predicate.Comparison cmp) {
      checkOperands(cmp.left(), List.of(cmp.right()), input, stage);
      checkOperands(cmp.right(), List.of(cmp.left()), input, stage);
    } else if (predicate instanceof Predicate.Between between) {
      checkOperands(between.operand(), List.of(between.low(), between.high()), input, stage);
    } else if (predicate instanceof Predicate.In in) {
      checkOperands(in.operand(), in.values(), input, stage);
    } else if (predicate instanceof Predicate.IsNull isNull) {
      checkOperands(isNull.operand(), List.of(), input, stage);
    }
  }

  private void checkOperands(Operand operand, List<Operand> peers, List<ResultColumn> input, String stage) {
    if (!(operand instanceof Operand.ColumnRef ref)) {
      return;
    }
    DataType type = require(input, ref.name(), stage).type();
    for (Operand peer : peers) {
      if (peer instanceof Operand.Literal literal) {
        try {
          Values.coerce(literal.value(), type);
        } catch (IllegalArgumentException e) {
          throw new PlanException(stage, null, ref.name(), e.getMessage(), e);
        }
      } else if (peer instanceof Operand.ColumnRef other) {
        DataType otherType = require(input, other.name(), stage).type();
        boolean compatible = type == otherType || (type != null && otherType != null && type.isNumeric()
            && otherType.isNumeric());
        if (!compatible) {
          throw new PlanException(stage, null, ref.name(), "Cannot compare " + type + " with " + otherType);
        }
      }
    }
  }

  private static ResultColumn require(List<ResultColumn> input, String name, String stage) {
    ResultColumn column = find(input, name);
    if (column == null) {
      throw new PlanException(stage, null, name, "Unknown column; input provides " + names(input));
    }
    return column;
  }

  private static ResultColumn find(List<ResultColumn> input, String name) {
    for (ResultColumn column : input) {
      if (column.name().equalsIgnoreCase(name)) {
        return column;
      }
    }
    return null;
  }

  private static List<String> names(List<ResultColumn> columns) {
    List<String> names = new ArrayList<>(columns.size());
    for (ResultColumn column : columns) {
      names.add(column.name());
    }
    return names;
  }
}
