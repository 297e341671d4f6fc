package se.alipsa.jcolumnar.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import se.alipsa.jcolumnar.error.SchemaMismatchException;

/**
 * Immutable description of a table: its columns, optional partition scheme and
 * optional sort key.
 */
public final class TableSchema {

  private final String name;
  private final List<ColumnDefinition> columns;
  private final Map<String, Integer> indexByName;
  private final PartitionScheme partitionScheme;
  private final String sortKey;

  private TableSchema(Builder builder) {
    this.name = builder.name;
    this.columns = List.copyOf(builder.columns);
    Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      String key = normalize(columns.get(i).name());
      if (index.putIfAbsent(key, i) != null) {
        throw new SchemaMismatchException("create-table", name, columns.get(i).name(), "Duplicate column name");
      }
    }
    this.indexByName = Collections.unmodifiableMap(index);
    this.partitionScheme = builder.partitionScheme;
    this.sortKey = builder.sortKey;
    if (columns.isEmpty()) {
      throw new SchemaMismatchException("create-table", name, null, "A table requires at least one column");
    }
    if (partitionScheme.isPartitioned()) {
      ColumnDefinition key = column(partitionScheme.column());
      if (key == null) {
        throw new SchemaMismatchException("create-table", name, partitionScheme.column(),
            "Partition key is not a column of the table");
      }
      if (partitionScheme.kind() == PartitionScheme.Kind.MONTHLY && key.type() != DataType.DATE) {
        throw new SchemaMismatchException("create-table", name, key.name(),
            "Monthly partitioning requires a DATE column but found " + key.type());
      }
    }
    if (sortKey != null && column(sortKey) == null) {
      throw new SchemaMismatchException("create-table", name, sortKey, "Sort key is not a column of the table");
    }
  }

  /**
   * Start building a schema for the named table.
   *
   * @param name
   *          the table name
   * @return a new builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Normalize an identifier for case-insensitive lookups.
   *
   * @param identifier
   *          the identifier
   * @return the lower-cased identifier
   */
  public static String normalize(String identifier) {
    return identifier == null ? null : identifier.toLowerCase(Locale.ROOT);
  }

  public String name() {
    return name;
  }

  public List<ColumnDefinition> columns() {
    return columns;
  }

  public PartitionScheme partitionScheme() {
    return partitionScheme;
  }

  /**
   * The declared sort key.
   *
   * @return the sort key column name or {@code null}
   */
  public String sortKey() {
    return sortKey;
  }

  /**
   * Number of columns.
   *
   * @return the column count
   */
  public int size() {
    return columns.size();
  }

  /**
   * Look up a column by name, ignoring case.
   *
   * @param columnName
   *          the column name
   * @return the definition or {@code null} when absent
   */
  public ColumnDefinition column(String columnName) {
    int idx = indexOf(columnName);
    return idx < 0 ? null : columns.get(idx);
  }

  /**
   * Position of a column, ignoring case.
   *
   * @param columnName
   *          the column name
   * @return the zero based index or {@code -1} when absent
   */
  public int indexOf(String columnName) {
    if (columnName == null) {
      return -1;
    }
    Integer idx = indexByName.get(normalize(columnName));
    return idx == null ? -1 : idx;
  }

  /**
   * Declared column names in schema order.
   *
   * @return the names
   */
  public List<String> columnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (ColumnDefinition column : columns) {
      names.add(column.name());
    }
    return names;
  }

  @Override
  public String toString() {
    return "TableSchema{" + name + ", columns=" + columns + ", partition=" + partitionScheme + ", sortKey=" + sortKey
        + '}';
  }

  /**
   * Mutable builder for {@link TableSchema}.
   */
  public static final class Builder {
    private final String name;
    private final List<ColumnDefinition> columns = new ArrayList<>();
    private PartitionScheme partitionScheme = PartitionScheme.none();
    private String sortKey;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
      if (name.isBlank()) {
        throw new IllegalArgumentException("Table name must not be blank");
      }
    }

    /**
     * Add a column.
     *
     * @param column
     *          the column definition
     * @return {@code this} for chaining
     */
    public Builder column(ColumnDefinition column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    /**
     * Configure the partition scheme.
     *
     * @param scheme
     *          the scheme
     * @return {@code this} for chaining
     */
    public Builder partitionBy(PartitionScheme scheme) {
      this.partitionScheme = Objects.requireNonNull(scheme, "scheme");
      return this;
    }

    /**
     * Declare the column the data is (mostly) sorted by.
     *
     * @param column
     *          the sort key column
     * @return {@code this} for chaining
     */
    public Builder sortKey(String column) {
      this.sortKey = column;
      return this;
    }

    /**
     * Build the immutable schema.
     *
     * @return the schema
     */
    public TableSchema build() {
      return new TableSchema(this);
    }
  }
}
