package se.alipsa.jcolumnar.predicate;

import java.util.BitSet;

/**
 * Boolean selection over the rows of a batch.
 */
public final class SelectionVector {

  private final BitSet selected;
  private final int length;

  SelectionVector(BitSet selected, int length) {
    this.selected = selected;
    this.length = length;
  }

  /**
   * Selection with every row selected.
   *
   * @param length
   *          number of rows
   * @return the selection
   */
  public static SelectionVector all(int length) {
    BitSet bits = new BitSet(length);
    bits.set(0, length);
    return new SelectionVector(bits, length);
  }

  /**
   * Length of the underlying batch.
   *
   * @return number of rows, selected or not
   */
  public int length() {
    return length;
  }

  public boolean isSelected(int row) {
    return selected.get(row);
  }

  /**
   * Number of selected rows.
   *
   * @return the selected count
   */
  public int count() {
    return selected.cardinality();
  }

  /**
   * Positions of the selected rows in ascending order.
   *
   * @return the selected row indexes
   */
  public int[] indices() {
    return selected.stream().toArray();
  }

  @Override
  public String toString() {
    return "SelectionVector{" + count() + "/" + length + "}";
  }
}
