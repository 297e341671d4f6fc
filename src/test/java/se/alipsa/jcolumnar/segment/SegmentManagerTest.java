package se.alipsa.jcolumnar.segment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import se.alipsa.jcolumnar.EngineConfig;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.predicate.BatchView;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.predicate.PredicateEvaluator;
import se.alipsa.jcolumnar.predicate.Predicates;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.RowBatch;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.store.codec.Encoding;

/**
 * Tests for segment description and statistics based pruning.
 */
class SegmentManagerTest {

  private static final String[] WORDS = {"alpha", "beta", "gamma", "delta", "epsilon"};

  private static ColumnStore sortedStore(long seed) {
    ColumnStore store = new ColumnStore(EngineConfig.defaults().toBuilder().segmentCapacity(50).build());
    store.createTable(TableSchema.builder("events")
        .column(ColumnDefinition.integer("ts"))
        .column(ColumnDefinition.string("kind"))
        .column(ColumnDefinition.integer("score"))
        .sortKey("ts")
        .build());
    Random random = new Random(seed);
    RowBatch.Builder batch = RowBatch.builder("ts", "kind", "score");
    for (int i = 0; i < 1000; i++) {
      Long score = random.nextInt(10) == 0 ? null : (long) random.nextInt(1000);
      // kinds cluster by segment so that distinct sets prune
      String kind = WORDS[(i / 50 + random.nextInt(2)) % WORDS.length];
      batch.row((long) i, kind, score);
    }
    store.append("events", batch.build());
    return store;
  }

  /**
   * Pruning never drops a segment that holds a matching row, checked against
   * an unpruned scan over many random predicates.
   */
  @Test
  void pruningNeverDropsMatchingSegments() {
    ColumnStore store = sortedStore(42);
    SegmentManager manager = new SegmentManager(store);
    List<Segment> segments = manager.segments("events");
    Random random = new Random(7);
    PredicateEvaluator evaluator = new PredicateEvaluator("filter", "events");
    int prunedSomething = 0;
    for (int i = 0; i < 300; i++) {
      Predicate predicate = randomPredicate(random, 3);
      List<Segment> kept = manager.prune(segments, predicate);
      Set<Integer> keptIds = new HashSet<>();
      for (Segment segment : kept) {
        keptIds.add(segment.id());
      }
      if (kept.size() < segments.size()) {
        prunedSomething++;
      }
      for (Segment segment : segments) {
        int matches = evaluator.evaluate(predicate, new SegmentView(segment)).count();
        if (matches > 0) {
          Assertions.assertTrue(keptIds.contains(segment.id()),
              "Segment " + segment.id() + " has " + matches + " rows matching " + predicate + " but was pruned");
        }
      }
    }
    Assertions.assertTrue(prunedSomething > 0, "Random predicates should prune at least some segments");
  }

  /**
   * A range on the sort key keeps only the overlapping segments.
   */
  @Test
  void sortKeyRangePrunesToOverlappingSegments() {
    SegmentManager manager = new SegmentManager(sortedStore(1));
    List<Segment> kept = manager.prune(manager.segments("events"), Predicates.between("ts", 120, 180));

    List<Integer> ids = new ArrayList<>();
    for (Segment segment : kept) {
      ids.add(segment.id());
    }
    Assertions.assertEquals(List.of(2, 3), ids, "Rows 120..180 live in segments 2 and 3");
  }

  /**
   * Descriptors expose encoding and statistics of one column per segment.
   */
  @Test
  void descriptorsDescribeColumnSegments() {
    SegmentManager manager = new SegmentManager(sortedStore(3));
    List<SegmentDescriptor> descriptors = manager.segmentsFor("events", "ts");

    Assertions.assertEquals(20, descriptors.size(), "1000 rows in segments of 50");
    SegmentDescriptor first = descriptors.get(0);
    Assertions.assertEquals(0L, first.statistics().min());
    Assertions.assertEquals(49L, first.statistics().max());
    Assertions.assertEquals(Encoding.DELTA, first.encoding());
    Assertions.assertEquals(DataType.INTEGER, first.type());
    Assertions.assertEquals(50, first.rowRange().length());

    List<SegmentDescriptor> kept = manager.pruneColumn(descriptors,
        Predicates.and(Predicates.ge("ts", 900), Predicates.eq("kind", "nowhere")));
    Assertions.assertEquals(2, kept.size(), "Conditions on other columns are treated as possibly true");
  }

  /**
   * Describing an unknown column is a plan error.
   */
  @Test
  void unknownColumnIsRejected() {
    SegmentManager manager = new SegmentManager(sortedStore(5));
    Assertions.assertThrows(PlanException.class, () -> manager.segmentsFor("events", "nope"));
  }

  private static Predicate randomPredicate(Random random, int depth) {
    int choice = random.nextInt(depth > 0 ? 9 : 6);
    long value = random.nextInt(1100) - 50;
    switch (choice) {
      case 0:
        return Predicates.lt(random.nextBoolean() ? "ts" : "score", value);
      case 1:
        return Predicates.ge(random.nextBoolean() ? "ts" : "score", value);
      case 2:
        return Predicates.eq(random.nextBoolean() ? "ts" : "score", value);
      case 3:
        return Predicates.between("ts", value, value + random.nextInt(80));
      case 4:
        return random.nextBoolean() ? Predicates.eq("kind", WORDS[random.nextInt(WORDS.length)])
            : Predicates.in("kind", WORDS[random.nextInt(WORDS.length)], "zeta");
      case 5:
        return random.nextBoolean() ? Predicates.isNull("score") : Predicates.ne("score", value);
      case 6:
        return Predicates.and(randomPredicate(random, depth - 1), randomPredicate(random, depth - 1));
      case 7:
        return Predicates.or(randomPredicate(random, depth - 1), randomPredicate(random, depth - 1));
      default:
        return Predicates.not(randomPredicate(random, depth - 1));
    }
  }

  private record SegmentView(Segment segment) implements BatchView {

    @Override
    public int rowCount() {
      return segment.rowCount();
    }

    @Override
    public int columnIndex(String name) {
      return segment.schema().indexOf(name);
    }

    @Override
    public DataType columnType(int column) {
      return segment.schema().columns().get(column).type();
    }

    @Override
    public Object value(int column, int row) {
      return segment.chunk(column).get(row);
    }
  }
}
