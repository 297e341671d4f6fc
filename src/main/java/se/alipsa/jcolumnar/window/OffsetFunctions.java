package se.alipsa.jcolumnar.window;

/**
 * LAG and LEAD over one sorted partition.
 */
final class OffsetFunctions {

  private OffsetFunctions() {
  }

  static void evaluate(WindowFunctionCall call, WindowPartition partition, Object[] argument, Object defaultValue,
      Object[] out) {
    int n = partition.size();
    long offset = call.parameter();
    long direction = call.function() == WindowFunctionType.LAG ? -1L : 1L;
    for (int i = 0; i < n; i++) {
      long target = i + direction * offset;
      out[partition.row(i)] = target >= 0 && target < n ? argument[partition.row((int) target)] : defaultValue;
    }
  }
}
