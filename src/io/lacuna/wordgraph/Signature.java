package io.lacuna.wordgraph;

import java.util.Arrays;

/**
 * The structural identity of a node: its terminal flag, its sorted edge labels, and the ids of the nodes each edge
 * points to. Since children are always registered before their parents, two nodes share a signature exactly when
 * they accept the same set of suffixes.
 */
final class Signature {

  private final boolean terminal;
  private final byte[] labels;
  private final int[] targets;
  private final int hash;

  Signature(boolean terminal, byte[] labels, int[] targets) {
    this.terminal = terminal;
    this.labels = labels;
    this.targets = targets;

    int h = terminal ? 1 : 0;
    h = 31 * h + Arrays.hashCode(labels);
    h = 31 * h + Arrays.hashCode(targets);
    this.hash = h;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Signature)) {
      return false;
    }

    Signature s = (Signature) obj;
    return hash == s.hash
            && terminal == s.terminal
            && Arrays.equals(labels, s.labels)
            && Arrays.equals(targets, s.targets);
  }

  // 1_abc_4_9_12
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(terminal ? "1_" : "0_");
    for (byte b : labels) {
      sb.append(Utils.printable(b & 0xFF));
    }
    for (int t : targets) {
      sb.append('_').append(t);
    }
    return sb.toString();
  }
}
