package se.alipsa.jcolumnar.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jcolumnar.error.PlanException;
import se.alipsa.jcolumnar.predicate.Predicate;
import se.alipsa.jcolumnar.predicate.StatisticsEvaluator;
import se.alipsa.jcolumnar.predicate.StatisticsEvaluator.StatisticsSource;
import se.alipsa.jcolumnar.store.ColumnDefinition;
import se.alipsa.jcolumnar.store.ColumnStore;
import se.alipsa.jcolumnar.store.DataType;
import se.alipsa.jcolumnar.store.TableSchema;
import se.alipsa.jcolumnar.store.TableSnapshot;

/**
 * Exposes the segmentation of stored tables and excludes segments that cannot
 * match a predicate.
 *
 * <p>
 * Pruning is conservative: a segment is dropped only when its statistics prove
 * that no row satisfies the predicate. Keeping a segment that does not match is
 * allowed, dropping one that does is a bug.
 * </p>
 */
public class SegmentManager {

  private static final Logger log = LoggerFactory.getLogger(SegmentManager.class);

  private final ColumnStore store;

  /**
   * Create a segment manager over a column store.
   *
   * @param store
   *          the store holding the tables
   */
  public SegmentManager(ColumnStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * The current segments of a table in row order.
   *
   * @param table
   *          the table name
   * @return the published segments
   */
  public List<Segment> segments(String table) {
    return store.snapshot(table).segments();
  }

  /**
   * Describe the segments of one column.
   *
   * @param table
   *          the table name
   * @param column
   *          the column name
   * @return descriptors in row order
   */
  public List<SegmentDescriptor> segmentsFor(String table, String column) {
    TableSnapshot snapshot = store.snapshot(table);
    TableSchema schema = snapshot.schema();
    int idx = schema.indexOf(column);
    if (idx < 0) {
      throw new PlanException("scan", schema.name(), column, "Unknown column");
    }
    ColumnDefinition def = schema.columns().get(idx);
    List<SegmentDescriptor> descriptors = new ArrayList<>(snapshot.segments().size());
    for (Segment segment : snapshot.segments()) {
      ColumnChunk chunk = segment.chunk(idx);
      descriptors.add(new SegmentDescriptor(segment.id(), segment.rowRange(), def.name(), def.type(),
          chunk.encoding(), chunk.statistics()));
    }
    return descriptors;
  }

  /**
   * Remove the segments that provably contain no matching row.
   *
   * @param segments
   *          candidate segments
   * @param predicate
   *          the filter, {@code null} keeps everything
   * @return the segments that may match, in input order
   */
  public List<Segment> prune(List<Segment> segments, Predicate predicate) {
    if (predicate == null) {
      return List.copyOf(segments);
    }
    List<Segment> kept = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      if (segment.rowCount() > 0 && StatisticsEvaluator.mayMatch(predicate, segment)) {
        kept.add(segment);
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("Pruning with {} kept {} of {} segments", predicate, kept.size(), segments.size());
    }
    return kept;
  }

  /**
   * Remove the descriptors whose column statistics prove the predicate never
   * matches. Conditions on other columns are treated as possibly true.
   *
   * @param descriptors
   *          descriptors of one column
   * @param predicate
   *          the filter
   * @return the descriptors that may match, in input order
   */
  public List<SegmentDescriptor> pruneColumn(List<SegmentDescriptor> descriptors, Predicate predicate) {
    if (predicate == null) {
      return List.copyOf(descriptors);
    }
    List<SegmentDescriptor> kept = new ArrayList<>(descriptors.size());
    for (SegmentDescriptor descriptor : descriptors) {
      if (StatisticsEvaluator.mayMatch(predicate, new DescriptorSource(descriptor))) {
        kept.add(descriptor);
      }
    }
    return kept;
  }

  private record DescriptorSource(SegmentDescriptor descriptor) implements StatisticsSource {

    @Override
    public ColumnStatistics statistics(String column) {
      return descriptor.column().equalsIgnoreCase(column) ? descriptor.statistics() : null;
    }

    @Override
    public DataType type(String column) {
      return descriptor.column().equalsIgnoreCase(column) ? descriptor.type() : null;
    }
  }
}
