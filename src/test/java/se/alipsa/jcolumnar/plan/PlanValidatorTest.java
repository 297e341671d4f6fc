package se.alipsa.jcolumnar.plan;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.EngineConfig;
import se.alipsa.jcolumnar.aggregate.AggregateSpec;
import se.alipsa.jcolumnar.error.ErrorKind;
import se.alipsa.jcolumnar.error.InvalidFrameSpecException;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.predicate.Predicates;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.window.FrameBound;
import se.alipsa.jcolumnar.window.FrameSpec;
import se.alipsa.jcolumnar.window.WindowFunctionCall;
import se.alipsa.jcolumnar.window.WindowFunctionType;
import se.alipsa.jcolumnar.window.WindowSpec;

/**
 * Tests for output schema derivation and plan checks before execution.
 */
class PlanValidatorTest {

  private PlanValidator validator;

  @BeforeEach
  void setUp() {
    ColumnStore store = new ColumnStore(EngineConfig.defaults());
    store.createTable(TableSchema.builder("sales")
        .column(ColumnDefinition.integer("id").notNull())
        .column(ColumnDefinition.string("region"))
        .column(ColumnDefinition.decimal("amount", 2))
        .column(ColumnDefinition.date("day"))
        .build());
    validator = new PlanValidator(store);
  }

  private static List<String> names(List<ResultColumn> columns) {
    return columns.stream().map(ResultColumn::name).toList();
  }

  @Test
  void scanWithoutColumnsReturnsWholeSchema() {
    List<ResultColumn> columns = validator.validate(PlanBuilder.scan("sales").build());
    Assertions.assertEquals(List.of("id", "region", "amount", "day"), names(columns));
    Assertions.assertEquals(DataType.DECIMAL, columns.get(2).type());
  }

  /**
   * Repeated scan columns appear once and keep the declared spelling.
   */
  @Test
  void scanColumnsAreDeduplicated() {
    List<ResultColumn> columns = validator.validate(PlanBuilder.scan("sales", "REGION", "region", "id").build());
    Assertions.assertEquals(List.of("region", "id"), names(columns));
  }

  @Test
  void groupByOutputsKeysThenAggregates() {
    PlanNode plan = PlanBuilder.scan("sales")
        .groupBy(List.of("region"), List.of(AggregateSpec.sum("amount", "total"), AggregateSpec.countStar("n"),
            AggregateSpec.avg("id", "avg_id")))
        .build();
    List<ResultColumn> columns = validator.validate(plan);
    Assertions.assertEquals(List.of("region", "total", "n", "avg_id"), names(columns));
    Assertions.assertEquals(List.of(DataType.STRING, DataType.DECIMAL, DataType.INTEGER, DataType.DOUBLE),
        columns.stream().map(ResultColumn::type).toList());
  }

  @Test
  void windowAppendsColumns() {
    WindowSpec byDay = WindowSpec.orderBy(SortKey.asc("day")).partitionBy("region");
    PlanNode plan = PlanBuilder.scan("sales", "region", "day", "amount")
        .window(WindowFunctionCall.rowNumber(byDay, "rn"),
            WindowFunctionCall.aggregate(WindowFunctionType.SUM, "amount", byDay, "running"))
        .build();
    List<ResultColumn> columns = validator.validate(plan);
    Assertions.assertEquals(List.of("region", "day", "amount", "rn", "running"), names(columns));
    Assertions.assertEquals(DataType.INTEGER, columns.get(3).type());
    Assertions.assertEquals(DataType.DECIMAL, columns.get(4).type());
  }

  @Test
  void projectRenames() {
    PlanNode plan = PlanBuilder.scan("sales")
        .project(List.of(ProjectItem.of("id", "sale_id"), ProjectItem.of("amount")))
        .build();
    Assertions.assertEquals(List.of(new ResultColumn("sale_id", DataType.INTEGER),
        new ResultColumn("amount", DataType.DECIMAL)), validator.validate(plan));
  }

  @Test
  void unknownTableAndColumns() {
    PlanException e = Assertions.assertThrows(PlanException.class,
        () -> validator.validate(PlanBuilder.scan("missing").build()));
    Assertions.assertEquals("missing", e.table());
    Assertions.assertEquals(ErrorKind.PLAN_ERROR, e.kind());

    e = Assertions.assertThrows(PlanException.class,
        () -> validator.validate(PlanBuilder.scan("sales").filter(Predicates.eq("price", 1)).build()));
    Assertions.assertEquals("price", e.column());
    Assertions.assertEquals("filter", e.stage());

    Assertions.assertThrows(PlanException.class,
        () -> validator.validate(PlanBuilder.scan("sales", "id").sort(SortKey.asc("region")).build()),
        "Sort can only use columns of its input");
  }

  /**
   * Literals that cannot be coerced to the column type fail before any data
   * is read.
   */
  @Test
  void incompatibleLiteralsAreRejected() {
    Assertions.assertThrows(PlanException.class,
        () -> validator.validate(PlanBuilder.scan("sales").filter(Predicates.gt("day", "not a date")).build()));
    Assertions.assertThrows(PlanException.class,
        () -> validator.validate(PlanBuilder.scan("sales").filter(Predicates.eq("id", "abc")).build()));
  }

  @Test
  void aggregateRules() {
    Assertions.assertThrows(PlanException.class, () -> validator.validate(PlanBuilder.scan("sales")
        .groupBy(List.of("region"), List.of(AggregateSpec.sum("region", "s"))).build()),
        "SUM is numeric only");
    Assertions.assertThrows(PlanException.class, () -> validator.validate(PlanBuilder.scan("sales")
        .groupBy(List.of("region"), List.of(AggregateSpec.countStar("region"))).build()),
        "Aggregate alias collides with the key");
    Assertions.assertThrows(PlanException.class, () -> validator.validate(PlanBuilder.scan("sales")
        .groupBy(List.of("region"), List.of(AggregateSpec.countStar("n")), Predicates.gt("amount", 1)).build()),
        "HAVING sees only keys and aggregates");
    Assertions.assertDoesNotThrow(() -> validator.validate(PlanBuilder.scan("sales")
        .groupBy(List.of("region"), List.of(AggregateSpec.countStar("n")), Predicates.gt("n", 1)).build()));
  }

  @Test
  void windowRules() {
    Assertions.assertThrows(InvalidFrameSpecException.class, () -> validator.validate(PlanBuilder.scan("sales")
        .window(WindowFunctionCall.aggregate(WindowFunctionType.SUM, "amount", WindowSpec.orderBy(SortKey.asc("region"))
            .frame(FrameSpec.range(FrameBound.preceding(1), FrameBound.currentRow())), "s"))
        .build()));
    Assertions.assertThrows(PlanException.class, () -> validator.validate(PlanBuilder.scan("sales")
        .window(WindowFunctionCall.rowNumber(WindowSpec.over(), "region")).build()),
        "Window output name collides with an input column");
  }

  @Test
  void limitMustNotBeNegative() {
    Assertions.assertThrows(PlanException.class,
        () -> validator.validate(PlanBuilder.scan("sales").limit(-1).build()));
    Assertions.assertThrows(PlanException.class,
        () -> validator.validate(PlanBuilder.scan("sales").limit(5, -2).build()));
  }

  @Test
  void orderingIsReportedOnlyAfterSort() {
    Assertions.assertTrue(PlanValidator.isOrdered(PlanBuilder.scan("sales").sort(SortKey.asc("id")).limit(3)
        .project("id").build()));
    Assertions.assertFalse(PlanValidator.isOrdered(PlanBuilder.scan("sales").project("id").build()));
    Assertions.assertFalse(PlanValidator.isOrdered(PlanBuilder.scan("sales").sort(SortKey.asc("id"))
        .groupBy(List.of("region"), List.of(AggregateSpec.countStar("n"))).build()));
  }
}
