package io.lacuna.wordgraph;

/**
 * A single edge in a {@link FlatWordGraph}.
 */
public final class ArrayEntry {

  private final int label;
  private final boolean terminal;
  private final boolean endOfList;
  private final int childIndex;

  /**
   * @param label the unsigned byte labeling the edge
   * @param terminal whether a word ends at the edge's target
   * @param endOfList whether this is the last edge out of its source node
   * @param childIndex the index of the target's first edge, or 0 if the target has no edges
   */
  public ArrayEntry(int label, boolean terminal, boolean endOfList, int childIndex) {
    if (label < 0 || label > 0xFF) {
      throw new IllegalArgumentException("label must be an unsigned byte, was " + label);
    }
    if (childIndex < 0) {
      throw new IllegalArgumentException("childIndex must be non-negative, was " + childIndex);
    }

    this.label = label;
    this.terminal = terminal;
    this.endOfList = endOfList;
    this.childIndex = childIndex;
  }

  public int label() {
    return label;
  }

  public boolean isTerminal() {
    return terminal;
  }

  public boolean isEndOfList() {
    return endOfList;
  }

  public int childIndex() {
    return childIndex;
  }

  // the root is never a target, so index 0 is free to mean "no children"
  public boolean hasChildren() {
    return childIndex != 0;
  }

  @Override
  public int hashCode() {
    int h = label;
    h = 31 * h + (terminal ? 1 : 0);
    h = 31 * h + (endOfList ? 1 : 0);
    return 31 * h + childIndex;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof ArrayEntry)) {
      return false;
    }

    ArrayEntry e = (ArrayEntry) obj;
    return label == e.label
            && terminal == e.terminal
            && endOfList == e.endOfList
            && childIndex == e.childIndex;
  }

  @Override
  public String toString() {
    return "entry[" + Utils.printable(label)
            + (terminal ? ", terminal" : "")
            + (endOfList ? ", eol" : "")
            + (hasChildren() ? ", -> " + childIndex : "")
            + "]";
  }
}
