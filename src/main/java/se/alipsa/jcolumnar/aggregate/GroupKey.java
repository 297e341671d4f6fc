package se.alipsa.jcolumnar.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tuple of grouping values. Nulls form their own group.
 */
final class GroupKey {

  private final List<Object> values;
  private final int hash;

  GroupKey(List<Object> values) {
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
    this.hash = this.values.hashCode();
  }

  List<Object> values() {
    return values;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GroupKey other)) {
      return false;
    }
    return hash == other.hash && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
