package se.alipsa.jcolumnar.window;

/**
 * ROW_NUMBER, RANK, DENSE_RANK, PERCENT_RANK, CUME_DIST and NTILE over one
 * sorted partition. Peers are rows equal in every ORDER BY key.
 */
final class RankingFunctions {

  private RankingFunctions() {
  }

  static void evaluate(WindowFunctionCall call, WindowPartition partition, Object[] out) {
    int n = partition.size();
    switch (call.function()) {
      case ROW_NUMBER -> {
        for (int i = 0; i < n; i++) {
          out[partition.row(i)] = (long) i + 1;
        }
      }
      case RANK -> {
        for (int i = 0; i < n; i++) {
          out[partition.row(i)] = rank(partition, i);
        }
      }
      case DENSE_RANK -> {
        long dense = 0;
        for (int i = 0; i < n; i++) {
          if (i == 0 || !partition.isPeer(i - 1, i)) {
            dense++;
          }
          out[partition.row(i)] = dense;
        }
      }
      case PERCENT_RANK -> {
        for (int i = 0; i < n; i++) {
          out[partition.row(i)] = n <= 1 ? 0.0d : (double) (rank(partition, i) - 1) / (n - 1);
        }
      }
      case CUME_DIST -> {
        for (int i = 0; i < n; i++) {
          out[partition.row(i)] = (double) partition.peerEnd(i) / n;
        }
      }
      case NTILE -> ntile(call.parameter(), partition, out);
      default -> throw new IllegalArgumentException(call.function() + " is not a ranking function");
    }
  }

  private static long rank(WindowPartition partition, int position) {
    return partition.peerStart(position) + 1L;
  }

  /**
   * Distribute the rows over {@code buckets} tiles; the first
   * {@code size % buckets} tiles get one extra row.
   */
  private static void ntile(long buckets, WindowPartition partition, Object[] out) {
    long n = partition.size();
    long base = n / buckets;
    long remainder = n % buckets;
    long threshold = remainder * (base + 1);
    for (int i = 0; i < n; i++) {
      long tile;
      if (i < threshold) {
        tile = i / (base + 1) + 1;
      } else {
        tile = remainder + (i - threshold) / base + 1;
      }
      out[partition.row(i)] = tile;
    }
  }
}
