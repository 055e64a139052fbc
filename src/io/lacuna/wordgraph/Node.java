package io.lacuna.wordgraph;

import java.util.Arrays;

/**
 * A node in a word graph. Outgoing edges are labeled with unsigned bytes and always kept in ascending label order;
 * targets are the ids of other nodes in the same builder's arena.
 */
public class Node {

  private static final byte[] NO_LABELS = new byte[0];
  private static final int[] NO_TARGETS = new int[0];

  final int id;
  boolean terminal;

  private byte[] labels = NO_LABELS;
  private int[] targets = NO_TARGETS;

  Node(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  /**
   * @return true if some inserted word ends at this node
   */
  public boolean isTerminal() {
    return terminal;
  }

  public boolean isLeaf() {
    return labels.length == 0;
  }

  public int edgeCount() {
    return labels.length;
  }

  /**
   * @return the unsigned label of the {@code i}th outgoing edge, in ascending label order
   */
  public int label(int i) {
    return labels[i] & 0xFF;
  }

  /**
   * @return the id of the node the {@code i}th outgoing edge points to
   */
  public int target(int i) {
    return targets[i];
  }

  /**
   * @return the id of the child reached by {@code label}, or -1 if there is no such edge
   */
  public int child(int label) {
    int idx = indexOf(label);
    return idx < 0 ? -1 : targets[idx];
  }

  void addEdge(int label, int childId) {
    if (labels.length > 0 && label(labels.length - 1) >= label) {
      throw new IllegalStateException("edge " + Utils.printable(label) + " added out of order to " + this);
    }

    labels = Arrays.copyOf(labels, labels.length + 1);
    targets = Arrays.copyOf(targets, targets.length + 1);
    labels[labels.length - 1] = (byte) label;
    targets[targets.length - 1] = childId;
  }

  void setChild(int label, int childId) {
    int idx = indexOf(label);
    if (idx < 0) {
      throw new IllegalStateException("no edge " + Utils.printable(label) + " on " + this);
    }
    targets[idx] = childId;
  }

  Signature signature() {
    return new Signature(terminal, labels.clone(), targets.clone());
  }

  // labels are few and sorted, a linear scan beats anything cleverer
  private int indexOf(int label) {
    for (int i = 0; i < labels.length; i++) {
      int l = labels[i] & 0xFF;
      if (l == label) {
        return i;
      } else if (l > label) {
        return -1;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("node(" + id + ")[");
    if (terminal) {
      sb.append("terminal");
    }
    for (int i = 0; i < labels.length; i++) {
      sb.append(sb.charAt(sb.length() - 1) == '[' ? "" : ", ")
              .append(Utils.printable(label(i)))
              .append(" -> ")
              .append(targets[i]);
    }
    sb.append("]");
    return sb.toString();
  }
}
