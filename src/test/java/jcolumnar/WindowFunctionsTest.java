package jcolumnar;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.ColumnarEngine;
import se.alipsa.jcolumnar.EngineConfig;
import se.alipsa.jcolumnar.exec.QueryResult;
import se.alipsa.jcolumnar.exec.ResultRow;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.PartitionScheme;
import se.alipsa.jcolumnar.store.RowBatch;
import se.alipsa.jcolumnar.store.TableSchema;

/**
 * Window functions run end to end through SQL.
 */
class WindowFunctionsTest {

  private ColumnarEngine engine;

  @BeforeEach
  void setUp() {
    engine = new ColumnarEngine(EngineConfig.defaults().toBuilder().segmentCapacity(2).workerThreads(2).build());
    engine.createTable(TableSchema.builder("readings")
        .column(ColumnDefinition.integer("id").notNull())
        .column(ColumnDefinition.date("day"))
        .column(ColumnDefinition.integer("value"))
        .build());
    engine.append("readings", RowBatch.builder("id", "day", "value")
        .row(1, LocalDate.of(2024, 1, 1), 10)
        .row(2, LocalDate.of(2024, 1, 2), 20)
        .row(3, LocalDate.of(2024, 1, 3), 30)
        .row(4, LocalDate.of(2024, 1, 4), 15)
        .row(5, LocalDate.of(2024, 1, 5), 25)
        .build());
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  /**
   * A cumulative SUM ordered by day yields the running totals.
   */
  @Test
  void runningTotal() {
    QueryResult result = engine.query("SELECT id, SUM(value) OVER (ORDER BY day) AS running FROM readings "
        + "ORDER BY id");
    Assertions.assertEquals(List.of(10L, 30L, 60L, 75L, 100L), result.column("running"),
        "Unexpected running totals");
  }

  @Test
  void runningTotalWithExplicitUnboundedFrame() {
    QueryResult result = engine.query("SELECT SUM(value) OVER (ORDER BY day ROWS BETWEEN UNBOUNDED PRECEDING "
        + "AND CURRENT ROW) AS running FROM readings ORDER BY id");
    Assertions.assertEquals(List.of(10L, 30L, 60L, 75L, 100L), result.column("running"));
  }

  /**
   * A two-row moving average; the first row averages only itself.
   */
  @Test
  void movingAverage() {
    QueryResult result = engine.query("SELECT id, AVG(value) OVER (ORDER BY day ROWS 1 PRECEDING) AS avg2 "
        + "FROM readings ORDER BY id");
    Assertions.assertEquals(List.of(10.0, 15.0, 25.0, 22.5, 20.0), result.column("avg2"),
        "Unexpected moving averages");
  }

  @Test
  void lagAndLead() {
    QueryResult result = engine.query("SELECT id, LAG(value) OVER (ORDER BY day) AS prev, "
        + "LEAD(value, 1, 0) OVER (ORDER BY day) AS nxt FROM readings ORDER BY id");
    Assertions.assertEquals(Arrays.asList(null, 10L, 20L, 30L, 15L), result.column("prev"));
    Assertions.assertEquals(List.of(20L, 30L, 15L, 25L, 0L), result.column("nxt"));
  }

  /**
   * Evaluating the same ranking twice assigns the same numbers to the same rows.
   */
  @Test
  void rankingIsDeterministic() {
    engine.append("readings", RowBatch.builder("id", "day", "value")
        .row(6, LocalDate.of(2024, 1, 6), 20)
        .row(7, LocalDate.of(2024, 1, 7), 20)
        .build());
    String sql = "SELECT id, RANK() OVER (ORDER BY value DESC) AS rk, DENSE_RANK() OVER (ORDER BY value DESC) "
        + "AS dr, ROW_NUMBER() OVER (ORDER BY value DESC) AS rn FROM readings ORDER BY id";

    QueryResult first = engine.query(sql);
    QueryResult second = engine.query(sql);

    Assertions.assertEquals(List.of(7L, 3L, 1L, 6L, 2L, 3L, 3L), first.column("rk"));
    Assertions.assertEquals(List.of(5L, 3L, 1L, 4L, 2L, 3L, 3L), first.column("dr"));
    Assertions.assertEquals(List.of(7L, 3L, 1L, 6L, 2L, 4L, 5L), first.column("rn"),
        "Ties are numbered in table order");
    for (int i = 0; i < first.size(); i++) {
      ResultRow a = first.rows().get(i);
      ResultRow b = second.rows().get(i);
      Assertions.assertEquals(a.values(), b.values(), "Row " + i + " differs between runs");
    }
  }

  @Test
  void ntileOverReadings() {
    QueryResult result = engine.query("SELECT id, NTILE(2) OVER (ORDER BY id) AS half FROM readings ORDER BY id");
    Assertions.assertEquals(List.of(1L, 1L, 1L, 2L, 2L), result.column("half"));
  }

  /**
   * Year to date totals over daily sums: the window runs over the grouped
   * rows.
   */
  @Test
  void runningTotalOfDailyAggregates() {
    engine.createTable(TableSchema.builder("flights")
        .column(ColumnDefinition.date("flight_date").notNull())
        .column(ColumnDefinition.decimal("co2", 1))
        .partitionBy(PartitionScheme.monthly("flight_date"))
        .build());
    engine.append("flights", RowBatch.builder("flight_date", "co2")
        .row(LocalDate.of(2024, 1, 2), new BigDecimal("1.5"))
        .row(LocalDate.of(2024, 1, 1), new BigDecimal("2.0"))
        .row(LocalDate.of(2024, 1, 2), new BigDecimal("0.5"))
        .row(LocalDate.of(2024, 2, 1), new BigDecimal("4.0"))
        .row(LocalDate.of(2024, 1, 1), null)
        .build());

    QueryResult result = engine.query("SELECT flight_date, SUM(co2) AS daily, SUM(SUM(co2)) OVER "
        + "(ORDER BY flight_date ROWS UNBOUNDED PRECEDING) AS ytd FROM flights GROUP BY flight_date "
        + "ORDER BY flight_date");

    Assertions.assertEquals(List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 2, 1)),
        result.column("flight_date"));
    Assertions.assertEquals(List.of(new BigDecimal("2.0"), new BigDecimal("2.0"), new BigDecimal("4.0")),
        result.column("daily"));
    Assertions.assertEquals(List.of(new BigDecimal("2.0"), new BigDecimal("4.0"), new BigDecimal("8.0")),
        result.column("ytd"));
  }
}
