package se.alipsa.jcolumnar.sql;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.DateValue;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.WindowElement;
import net.sf.jsqlparser.expression.WindowOffset;
import net.sf.jsqlparser.expression.WindowRange;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.expression.operators.relational.NotEqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.aggregate.AggregateFunction;
import se.alipsa.jcolumnar.aggregate.AggregateSpec;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.plan.NullOrdering;
import se.alipsa.jcolumnar.plan.PlanBuilder;
import se.alipsa.jcolumnar.plan.PlanNode;
import se.alipsa.jcolumnar.plan.ProjectItem;
import se.alipsa.jcolumnar.plan.SortKey;
import se.alipsa.jcolumnar.predicate.ComparisonOperator;
import se.alipsa.jcolumnar.predicate.Operand;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.window.FrameBound;
import se.alipsa.jcolumnar.window.FrameSpec;
import se.alipsa.jcolumnar.window.WindowFunctionCall;
import se.alipsa.jcolumnar.window.WindowFunctionType;
import se.alipsa.jcolumnar.window.WindowSpec;

/**
 * Translates a single SQL SELECT into a logical plan.
 *
 * <p>
 * Supported: one FROM table, WHERE with comparisons, AND/OR/NOT, BETWEEN, IN
 * lists and IS NULL, GROUP BY over columns, HAVING over aggregates or their
 * aliases, aggregate and window calls (including a window over an aggregate
 * such as {@code SUM(SUM(x)) OVER (ORDER BY d)}), ORDER BY by name, alias or
 * select position, and LIMIT/OFFSET. The resulting plan is
 * Scan, Filter, GroupBy, Window, Sort, Limit and Project, in that order, each
 * present only when needed.
 * </p>
 */
public class SqlPlanner {

  private static final Logger log = LoggerFactory.getLogger(SqlPlanner.class);

  private static final String STAGE = "sql";

  private final ColumnStore store;

  /**
   * Create a planner resolving {@code SELECT *} against a store.
   *
   * @param store
   *          the column store
   */
  public SqlPlanner(ColumnStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Parse and translate a query.
   *
   * @param sql
   *          the SELECT statement
   * @return the logical plan
   * @throws PlanException
   *           if the statement cannot be parsed or uses unsupported constructs
   */
  public PlanNode plan(String sql) {
    Objects.requireNonNull(sql, "sql");
    Statement statement;
    try {
      statement = CCJSqlParserUtil.parse(sql);
    } catch (JSQLParserException e) {
      throw new PlanException(STAGE, null, null, "Failed to parse SQL: " + sql, e);
    }
    if (!(statement instanceof PlainSelect select)) {
      throw new PlanException(STAGE, null, null, "Only a plain SELECT is supported: " + sql);
    }
    PlanNode plan = new Translation(select).translate();
    if (log.isDebugEnabled()) {
      log.debug("Planned '{}' as {}", sql, plan);
    }
    return plan;
  }

  /**
   * State of one translation: the aggregates and window calls collected from
   * the query and the names they are exposed under.
   */
  private final class Translation {

    private final PlainSelect select;
    private String table;
    private final Map<String, AggregateSpec> aggregates = new LinkedHashMap<>();
    private final List<WindowFunctionCall> windows = new ArrayList<>();
    private final List<ProjectItem> outputs = new ArrayList<>();
    private final Set<String> usedNames = new HashSet<>();
    private int hidden;

    Translation(PlainSelect select) {
      this.select = select;
    }

    PlanNode translate() {
      checkShape();
      List<String> keys = groupingKeys();
      for (SelectItem<?> item : select.getSelectItems()) {
        selectItem(item);
      }
      Predicate where = select.getWhere() == null ? null : predicate(select.getWhere(), false);
      Predicate having = select.getHaving() == null ? null : predicate(select.getHaving(), true);
      List<SortKey> orderBy = orderBy();

      PlanBuilder builder = PlanBuilder.scan(table);
      if (where != null) {
        builder.filter(where);
      }
      if (!keys.isEmpty() || !aggregates.isEmpty()) {
        builder.groupBy(keys, new ArrayList<>(aggregates.values()), having);
      } else if (having != null) {
        throw new PlanException(STAGE, table, null, "HAVING requires GROUP BY or an aggregate");
      }
      if (!windows.isEmpty()) {
        builder.window(windows);
      }
      if (!orderBy.isEmpty()) {
        builder.sort(orderBy);
      }
      Limit limit = select.getLimit();
      long offset = offset();
      if (limit != null && limit.getRowCount() != null) {
        builder.limit(wholeNumber(limit.getRowCount(), "LIMIT"), offset);
      } else if (offset > 0) {
        builder.limit(Long.MAX_VALUE, offset);
      }
      builder.project(outputs);
      return builder.build();
    }

    private void checkShape() {
      if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
        throw unsupported("WITH clauses");
      }
      if (select.getDistinct() != null) {
        throw unsupported("DISTINCT");
      }
      if (select.getJoins() != null && !select.getJoins().isEmpty()) {
        throw unsupported("joins");
      }
      if (!(select.getFromItem() instanceof Table from)) {
        throw unsupported("FROM " + select.getFromItem());
      }
      table = from.getName();
    }

    private List<String> groupingKeys() {
      GroupByElement groupBy = select.getGroupBy();
      List<String> keys = new ArrayList<>();
      if (groupBy == null || groupBy.getGroupByExpressionList() == null) {
        return keys;
      }
      for (Object expression : groupBy.getGroupByExpressionList()) {
        if (!(expression instanceof Column column)) {
          throw unsupported("GROUP BY expression " + expression);
        }
        keys.add(column.getColumnName());
      }
      return keys;
    }

    private void selectItem(SelectItem<?> item) {
      Expression expression = item.getExpression();
      String alias = item.getAlias() == null ? null : item.getAlias().getName();
      if (expression instanceof AllColumns) {
        TableSchema schema = store.schema(table);
        if (schema == null) {
          throw new PlanException(STAGE, table, null, "Unknown table");
        }
        for (ColumnDefinition column : schema.columns()) {
          addOutput(column.name(), column.name());
        }
      } else if (expression instanceof Column column) {
        addOutput(column.getColumnName(), alias == null ? column.getColumnName() : alias);
      } else if (expression instanceof AnalyticExpression analytic) {
        String name = uniqueName(alias == null ? analytic.getName().toLowerCase(Locale.ROOT) : alias);
        windows.add(windowCall(analytic, name));
        addOutput(name, name);
      } else if (expression instanceof Function function && isAggregate(function)) {
        String name = alias == null ? uniqueName(defaultName(function)) : uniqueName(alias);
        AggregateSpec spec = aggregateSpec(function, name);
        aggregates.putIfAbsent(name, spec);
        addOutput(name, name);
      } else {
        throw unsupported("select expression " + expression);
      }
    }

    private void addOutput(String column, String alias) {
      usedNames.add(TableSchema.normalize(alias));
      outputs.add(ProjectItem.of(column, alias));
    }

    private String uniqueName(String base) {
      String name = base;
      int suffix = 2;
      while (usedNames.contains(TableSchema.normalize(name))) {
        name = base + "_" + suffix++;
      }
      usedNames.add(TableSchema.normalize(name));
      return name;
    }

    private String defaultName(Function function) {
      String name = function.getName().toLowerCase(Locale.ROOT);
      String argument = aggregateArgument(function);
      String prefix = function.isDistinct() ? name + "_distinct_" : name + "_";
      return prefix + (argument == null ? "star" : argument.toLowerCase(Locale.ROOT));
    }

    /**
     * The name under which an aggregate call is available after grouping,
     * registering a hidden aggregate when the query does not select it.
     */
    private String aggregateReference(Function function) {
      AggregateSpec wanted = aggregateSpec(function, "wanted");
      for (AggregateSpec spec : aggregates.values()) {
        if (spec.function() == wanted.function() && Objects.equals(spec.column(), wanted.column())
            && spec.distinct() == wanted.distinct()) {
          return spec.alias();
        }
      }
      String name = uniqueName("$agg" + (++hidden));
      aggregates.put(name, aggregateSpec(function, name));
      return name;
    }

    private boolean isAggregate(Function function) {
      return AggregateFunction.from(function.getName()) != null;
    }

    private AggregateSpec aggregateSpec(Function function, String alias) {
      AggregateFunction aggregate = AggregateFunction.from(function.getName());
      if (aggregate == null) {
        throw unsupported("function " + function.getName());
      }
      String argument = aggregateArgument(function);
      if (function.isDistinct()) {
        if (aggregate != AggregateFunction.COUNT || argument == null) {
          throw unsupported("DISTINCT in " + aggregate);
        }
        return AggregateSpec.countDistinct(argument, alias);
      }
      if (argument == null) {
        if (aggregate != AggregateFunction.COUNT) {
          throw new PlanException(STAGE, table, null, aggregate + "(*) is not supported");
        }
        return AggregateSpec.countStar(alias);
      }
      return new AggregateSpec(aggregate, argument, alias);
    }

    private String aggregateArgument(Function function) {
      if (function.isAllColumns()) {
        return null;
      }
      ExpressionList<?> parameters = function.getParameters();
      if (parameters == null || parameters.size() != 1) {
        throw unsupported("aggregate arguments of " + function);
      }
      Expression argument = parameters.get(0);
      if (argument instanceof AllColumns) {
        return null;
      }
      if (!(argument instanceof Column column)) {
        throw unsupported("aggregate argument " + argument);
      }
      return column.getColumnName();
    }

    private WindowFunctionCall windowCall(AnalyticExpression analytic, String alias) {
      WindowFunctionType type = WindowFunctionType.from(analytic.getName());
      if (type == null) {
        throw unsupported("window function " + analytic.getName());
      }
      if (analytic.isDistinct()) {
        throw unsupported("DISTINCT window aggregates");
      }
      WindowSpec window = windowSpec(analytic);
      Expression argumentExpression = analytic.getExpression();
      if (type == WindowFunctionType.NTILE) {
        if (argumentExpression == null) {
          throw new PlanException(STAGE, table, alias, "NTILE requires a bucket count");
        }
        return WindowFunctionCall.ntile(wholeNumber(argumentExpression, "NTILE"), window, alias);
      }
      String argument = null;
      if (!analytic.isAllColumns() && argumentExpression != null && !(argumentExpression instanceof AllColumns)) {
        argument = columnOrAggregate(argumentExpression);
      }
      if (type.isOffset()) {
        long offset = analytic.getOffset() == null ? 1L : wholeNumber(analytic.getOffset(), type.name());
        Object defaultValue = analytic.getDefaultValue() == null ? null : literal(analytic.getDefaultValue());
        return new WindowFunctionCall(type, argument, offset, defaultValue, window, alias);
      }
      return new WindowFunctionCall(type, argument, null, null, window, alias);
    }

    private WindowSpec windowSpec(AnalyticExpression analytic) {
      List<String> partitionBy = new ArrayList<>();
      if (analytic.getPartitionExpressionList() != null) {
        for (Object expression : analytic.getPartitionExpressionList()) {
          partitionBy.add(columnOrAggregate((Expression) expression));
        }
      }
      List<SortKey> orderBy = new ArrayList<>();
      if (analytic.getOrderByElements() != null) {
        for (OrderByElement element : analytic.getOrderByElements()) {
          orderBy.add(sortKey(element, columnOrAggregate(element.getExpression())));
        }
      }
      FrameSpec frame = analytic.getWindowElement() == null ? null : frame(analytic.getWindowElement());
      return new WindowSpec(partitionBy, orderBy, frame);
    }

    private FrameSpec frame(WindowElement element) {
      boolean rows = element.getType() == WindowElement.Type.ROWS;
      FrameBound start;
      FrameBound end;
      WindowRange range = element.getRange();
      if (range != null) {
        start = bound(range.getStart());
        end = bound(range.getEnd());
      } else {
        WindowOffset offset = element.getOffset();
        if (offset != null && offset.getType() == WindowOffset.Type.FOLLOWING) {
          start = FrameBound.currentRow();
          end = bound(offset);
        } else {
          start = bound(offset);
          end = FrameBound.currentRow();
        }
      }
      return rows ? FrameSpec.rows(start, end) : FrameSpec.range(start, end);
    }

    private FrameBound bound(WindowOffset offset) {
      if (offset == null || offset.getType() == WindowOffset.Type.CURRENT) {
        return FrameBound.currentRow();
      }
      WindowOffset.Type type = offset.getType();
      if (offset.getExpression() == null) {
        return type == WindowOffset.Type.FOLLOWING ? FrameBound.unboundedFollowing()
            : FrameBound.unboundedPreceding();
      }
      Object value = literal(offset.getExpression());
      if (!(value instanceof Number number)) {
        throw new PlanException(STAGE, table, null, "Frame offset must be a numeric literal: " + offset);
      }
      BigDecimal amount = number instanceof BigDecimal decimal ? decimal : new BigDecimal(number.toString());
      return type == WindowOffset.Type.FOLLOWING ? FrameBound.following(amount) : FrameBound.preceding(amount);
    }

    private String columnOrAggregate(Expression expression) {
      Expression unwrapped = unwrap(expression);
      if (unwrapped instanceof Column column) {
        return column.getColumnName();
      }
      if (unwrapped instanceof Function function && isAggregate(function)) {
        return aggregateReference(function);
      }
      throw unsupported("expression " + expression);
    }

    private List<SortKey> orderBy() {
      List<SortKey> keys = new ArrayList<>();
      if (select.getOrderByElements() == null) {
        return keys;
      }
      for (OrderByElement element : select.getOrderByElements()) {
        keys.add(sortKey(element, orderColumn(element.getExpression())));
      }
      return keys;
    }

    private String orderColumn(Expression expression) {
      if (expression instanceof LongValue position) {
        long index = position.getValue();
        if (index < 1 || index > outputs.size()) {
          throw new PlanException(STAGE, table, null, "ORDER BY position " + index + " is out of range");
        }
        return outputs.get((int) index - 1).column();
      }
      if (expression instanceof Column column) {
        for (ProjectItem item : outputs) {
          if (item.alias().equalsIgnoreCase(column.getColumnName())) {
            return item.column();
          }
        }
      }
      return columnOrAggregate(expression);
    }

    private SortKey sortKey(OrderByElement element, String column) {
      SortKey key = element.isAsc() ? SortKey.asc(column) : SortKey.desc(column);
      if (element.getNullOrdering() == OrderByElement.NullOrdering.NULLS_FIRST) {
        return key.nulls(NullOrdering.NULLS_FIRST);
      }
      if (element.getNullOrdering() == OrderByElement.NullOrdering.NULLS_LAST) {
        return key.nulls(NullOrdering.NULLS_LAST);
      }
      return key;
    }

    private long offset() {
      if (select.getOffset() != null && select.getOffset().getOffset() != null) {
        return wholeNumber(select.getOffset().getOffset(), "OFFSET");
      }
      Limit limit = select.getLimit();
      if (limit != null && limit.getOffset() != null) {
        return wholeNumber(limit.getOffset(), "OFFSET");
      }
      return 0L;
    }

    private Predicate predicate(Expression expression, boolean having) {
      Expression e = unwrap(expression);
      if (e instanceof AndExpression and) {
        return new Predicate.And(predicate(and.getLeftExpression(), having),
            predicate(and.getRightExpression(), having));
      }
      if (e instanceof OrExpression or) {
        return new Predicate.Or(predicate(or.getLeftExpression(), having), predicate(or.getRightExpression(), having));
      }
      if (e instanceof NotExpression not) {
        return new Predicate.Not(predicate(not.getExpression(), having));
      }
      if (e instanceof EqualsTo eq) {
        return comparison(ComparisonOperator.EQ, eq.getLeftExpression(), eq.getRightExpression(), having);
      }
      if (e instanceof NotEqualsTo ne) {
        return comparison(ComparisonOperator.NE, ne.getLeftExpression(), ne.getRightExpression(), having);
      }
      if (e instanceof GreaterThan gt) {
        return comparison(ComparisonOperator.GT, gt.getLeftExpression(), gt.getRightExpression(), having);
      }
      if (e instanceof GreaterThanEquals ge) {
        return comparison(ComparisonOperator.GE, ge.getLeftExpression(), ge.getRightExpression(), having);
      }
      if (e instanceof MinorThan lt) {
        return comparison(ComparisonOperator.LT, lt.getLeftExpression(), lt.getRightExpression(), having);
      }
      if (e instanceof MinorThanEquals le) {
        return comparison(ComparisonOperator.LE, le.getLeftExpression(), le.getRightExpression(), having);
      }
      if (e instanceof Between between) {
        return new Predicate.Between(operand(between.getLeftExpression(), having),
            operand(between.getBetweenExpressionStart(), having), operand(between.getBetweenExpressionEnd(), having),
            between.isNot());
      }
      if (e instanceof InExpression in) {
        if (!(in.getRightExpression() instanceof ExpressionList<?> list)) {
          throw unsupported("IN " + in.getRightExpression());
        }
        List<Operand> values = new ArrayList<>(list.size());
        for (Expression value : list) {
          values.add(operand(value, having));
        }
        return new Predicate.In(operand(in.getLeftExpression(), having), values, in.isNot());
      }
      if (e instanceof IsNullExpression isNull) {
        return new Predicate.IsNull(operand(isNull.getLeftExpression(), having), isNull.isNot());
      }
      throw unsupported("condition " + expression);
    }

    private Predicate comparison(ComparisonOperator operator, Expression left, Expression right, boolean having) {
      return new Predicate.Comparison(operator, operand(left, having), operand(right, having));
    }

    private Operand operand(Expression expression, boolean having) {
      Expression e = unwrap(expression);
      if (e instanceof Column column) {
        String name = column.getColumnName();
        if (having) {
          // HAVING may refer to an aggregate through its select alias
          for (ProjectItem item : outputs) {
            if (item.alias().equalsIgnoreCase(name)) {
              return new Operand.ColumnRef(item.column());
            }
          }
        }
        return new Operand.ColumnRef(name);
      }
      if (e instanceof Function function && isAggregate(function)) {
        if (!having) {
          throw new PlanException(STAGE, table, null, "Aggregate " + function + " is not allowed in WHERE");
        }
        return new Operand.ColumnRef(aggregateReference(function));
      }
      return new Operand.Literal(literal(e));
    }

    private Object literal(Expression expression) {
      Expression e = unwrap(expression);
      if (e instanceof NullValue) {
        return null;
      }
      if (e instanceof LongValue value) {
        return value.getValue();
      }
      if (e instanceof DoubleValue) {
        return new BigDecimal(e.toString());
      }
      if (e instanceof StringValue value) {
        return value.getValue();
      }
      if (e instanceof DateValue value) {
        return value.getValue().toLocalDate();
      }
      if (e instanceof SignedExpression signed) {
        Object inner = literal(signed.getExpression());
        if (signed.getSign() == '-' && inner instanceof Long number) {
          return -number;
        }
        if (signed.getSign() == '-' && inner instanceof BigDecimal number) {
          return number.negate();
        }
        if (signed.getSign() == '+' && inner instanceof Number) {
          return inner;
        }
      }
      throw unsupported("expression " + expression);
    }

    private long wholeNumber(Expression expression, String clause) {
      Object value = literal(expression);
      if (!(value instanceof Long number)) {
        throw new PlanException(STAGE, table, null, clause + " must be an integer literal: " + expression);
      }
      return number;
    }

    private Expression unwrap(Expression expression) {
      Expression e = expression;
      while (true) {
        if (e instanceof Parenthesis parenthesis) {
          e = parenthesis.getExpression();
        } else if (e instanceof ParenthesedExpressionList<?> list && list.size() == 1) {
          e = list.get(0);
        } else {
          return e;
        }
      }
    }

    private PlanException unsupported(String what) {
      return new PlanException(STAGE, table, null, "Unsupported " + what);
    }
  }
}
