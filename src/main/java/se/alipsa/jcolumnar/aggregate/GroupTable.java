package se.alipsa.jcolumnar.aggregate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.alipsa.jcolumnar.predicate.BatchView;
import se.alipsa.jcolumnar.store.DataType;

/**
 * Hash table from group key to accumulators. Iteration follows the order in
 * which keys were first seen.
 */
final class GroupTable {

  private final int[] keyColumns;
  private final int[] argumentColumns;
  private final List<AggregateSpec> specs;
  private final DataType[] argumentTypes;
  private final String stage;
  private final Map<GroupKey, AggregateAccumulator[]> groups = new LinkedHashMap<>();

  GroupTable(int[] keyColumns, int[] argumentColumns, List<AggregateSpec> specs, DataType[] argumentTypes,
      String stage) {
    this.keyColumns = keyColumns;
    this.argumentColumns = argumentColumns;
    this.specs = specs;
    this.argumentTypes = argumentTypes;
    this.stage = stage;
  }

  void addRows(BatchView batch, int from, int to) {
    List<Object> key = new ArrayList<>(keyColumns.length);
    for (int row = from; row < to; row++) {
      key.clear();
      for (int k : keyColumns) {
        key.add(batch.value(k, row));
      }
      AggregateAccumulator[] accumulators = groups.get(new GroupKey(key));
      if (accumulators == null) {
        accumulators = newAccumulators();
        groups.put(new GroupKey(key), accumulators);
      }
      for (int a = 0; a < accumulators.length; a++) {
        int arg = argumentColumns[a];
        accumulators[a].add(arg < 0 ? null : batch.value(arg, row));
      }
    }
  }

  void ensureGlobalGroup() {
    if (groups.isEmpty()) {
      groups.put(new GroupKey(List.of()), newAccumulators());
    }
  }

  /**
   * Absorb a partial table built over later rows. Keys first seen in
   * {@code other} are appended after the keys of this table.
   */
  void merge(GroupTable other) {
    for (Map.Entry<GroupKey, AggregateAccumulator[]> entry : other.groups.entrySet()) {
      AggregateAccumulator[] mine = groups.get(entry.getKey());
      if (mine == null) {
        groups.put(entry.getKey(), entry.getValue());
        continue;
      }
      AggregateAccumulator[] theirs = entry.getValue();
      for (int a = 0; a < mine.length; a++) {
        mine[a].merge(theirs[a]);
      }
    }
  }

  int size() {
    return groups.size();
  }

  List<GroupResult> results() {
    List<GroupResult> results = new ArrayList<>(groups.size());
    for (Map.Entry<GroupKey, AggregateAccumulator[]> entry : groups.entrySet()) {
      List<Object> values = new ArrayList<>(specs.size());
      for (AggregateAccumulator accumulator : entry.getValue()) {
        values.add(accumulator.result());
      }
      results.add(new GroupResult(entry.getKey().values(), values));
    }
    return results;
  }

  private AggregateAccumulator[] newAccumulators() {
    AggregateAccumulator[] accumulators = new AggregateAccumulator[specs.size()];
    for (int i = 0; i < accumulators.length; i++) {
      AggregateSpec spec = specs.get(i);
      accumulators[i] = AggregateAccumulator.create(spec.function(), argumentTypes[i], spec.isCountStar(),
          spec.distinct(), stage, spec.column());
    }
    return accumulators;
  }
}
