package se.alipsa.jcolumnar.segment;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts scanned and pruned segments.
 */
public class SegmentAccessCounter implements SegmentAccessListener {

  private final AtomicInteger scanned = new AtomicInteger();
  private final AtomicInteger pruned = new AtomicInteger();
  private final Set<Integer> scannedIds = new ConcurrentSkipListSet<>();

  @Override
  public void segmentScanned(String table, int segmentId) {
    scanned.incrementAndGet();
    scannedIds.add(segmentId);
  }

  @Override
  public void segmentPruned(String table, int segmentId) {
    pruned.incrementAndGet();
  }

  public int scanned() {
    return scanned.get();
  }

  public int pruned() {
    return pruned.get();
  }

  /**
   * Ids of the scanned segments.
   *
   * @return a sorted copy
   */
  public Set<Integer> scannedSegmentIds() {
    return new TreeSet<>(scannedIds);
  }

  /** Reset all counters. */
  public void reset() {
    scanned.set(0);
    pruned.set(0);
    scannedIds.clear();
  }

  @Override
  public String toString() {
    return "SegmentAccessCounter{scanned=" + scanned + ", pruned=" + pruned + "}";
  }
}
