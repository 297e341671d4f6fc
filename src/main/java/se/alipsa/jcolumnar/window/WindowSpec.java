package se.alipsa.jcolumnar.window;

import java.util.List;
import se.alipsa.jcolumnar.plan.SortKey;

/**
 * The OVER clause of a window function call.
 *
 * @param partitionBy
 *          PARTITION BY columns, may be empty
 * @param orderBy
 *          ORDER BY keys, may be empty
 * @param frame
 *          explicit frame or {@code null} for the default frame
 */
public record WindowSpec(List<String> partitionBy, List<SortKey> orderBy, FrameSpec frame) {

  /**
   * Copying constructor.
   */
  public WindowSpec {
    partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  /**
   * An empty window: one partition holding every row.
   *
   * @return the spec
   */
  public static WindowSpec over() {
    return new WindowSpec(List.of(), List.of(), null);
  }

  /**
   * Window ordered by the given keys.
   *
   * @param keys
   *          ORDER BY keys
   * @return the spec
   */
  public static WindowSpec orderBy(SortKey... keys) {
    return new WindowSpec(List.of(), List.of(keys), null);
  }

  /**
   * Copy with PARTITION BY columns.
   *
   * @param columns
   *          partition columns
   * @return the new spec
   */
  public WindowSpec partitionBy(String... columns) {
    return new WindowSpec(List.of(columns), orderBy, frame);
  }

  /**
   * Copy with an explicit frame.
   *
   * @param frameSpec
   *          the frame
   * @return the new spec
   */
  public WindowSpec frame(FrameSpec frameSpec) {
    return new WindowSpec(partitionBy, orderBy, frameSpec);
  }

  /**
   * The frame in effect: the explicit one, otherwise RANGE UNBOUNDED PRECEDING
   * to CURRENT ROW when ordered and the whole partition when not.
   *
   * @return the frame
   */
  public FrameSpec effectiveFrame() {
    if (frame != null) {
      return frame;
    }
    return orderBy.isEmpty() ? FrameSpec.WHOLE_PARTITION : FrameSpec.DEFAULT_ORDERED;
  }

  /**
   * Identity of the partition build: calls with equal keys share one
   * partitioning and sort.
   *
   * @return the build key
   */
  PartitionKey partitionKey() {
    return new PartitionKey(partitionBy, orderBy);
  }

  record PartitionKey(List<String> partitionBy, List<SortKey> orderBy) {
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("OVER (");
    if (!partitionBy.isEmpty()) {
      sb.append("PARTITION BY ").append(String.join(", ", partitionBy));
    }
    if (!orderBy.isEmpty()) {
      sb.append(partitionBy.isEmpty() ? "" : " ").append("ORDER BY ");
      for (int i = 0; i < orderBy.size(); i++) {
        sb.append(i == 0 ? "" : ", ").append(orderBy.get(i));
      }
    }
    if (frame != null) {
      sb.append(' ').append(frame);
    }
    return sb.append(')').toString();
  }
}
