package se.alipsa.jcolumnar.store;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Describes how rows are grouped into segments besides the fixed segment
 * capacity. When a partition key is configured an open segment is closed as
 * soon as an appended row carries a different partition label, so every
 * segment holds rows of exactly one partition.
 *
 * @param kind
 *          the partitioning strategy
 * @param column
 *          the partition key column, {@code null} for {@link Kind#NONE}
 */
public record PartitionScheme(Kind kind, String column) {

  private static final PartitionScheme NONE = new PartitionScheme(Kind.NONE, null);

  /** Supported partitioning strategies. */
  public enum Kind {
    /** Segments are cut by insertion order only. */
    NONE,
    /** Each distinct key value gets its own segments. */
    BY_VALUE,
    /** DATE key, one partition per calendar month. */
    MONTHLY
  }

  /**
   * Validating constructor.
   */
  public PartitionScheme {
    Objects.requireNonNull(kind, "kind");
    if (kind != Kind.NONE && (column == null || column.isBlank())) {
      throw new IllegalArgumentException(kind + " partitioning requires a key column");
    }
  }

  /**
   * No partition key.
   *
   * @return the insertion-order scheme
   */
  public static PartitionScheme none() {
    return NONE;
  }

  /**
   * Partition by the distinct values of a column.
   *
   * @param column
   *          the key column
   * @return the scheme
   */
  public static PartitionScheme byValue(String column) {
    return new PartitionScheme(Kind.BY_VALUE, column);
  }

  /**
   * Partition a DATE column by calendar month.
   *
   * @param column
   *          the DATE key column
   * @return the scheme
   */
  public static PartitionScheme monthly(String column) {
    return new PartitionScheme(Kind.MONTHLY, column);
  }

  /**
   * Whether a partition key is configured.
   *
   * @return {@code false} for {@link Kind#NONE}
   */
  public boolean isPartitioned() {
    return kind != Kind.NONE;
  }

  /**
   * Compute the partition label of a key value.
   *
   * @param keyValue
   *          the normalized key column value, may be {@code null}
   * @return the label rows are grouped by
   */
  public Object label(Object keyValue) {
    if (keyValue == null) {
      return null;
    }
    return switch (kind) {
      case NONE -> null;
      case BY_VALUE -> keyValue;
      case MONTHLY -> YearMonth.from((LocalDate) keyValue);
    };
  }
}
