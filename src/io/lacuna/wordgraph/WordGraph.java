package io.lacuna.wordgraph;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Optional;

/**
 * A finished, minimal word graph. Instances are created by {@link WordGraphBuilder#finish()}, are never modified
 * afterwards, and can be queried from any number of threads.
 *
 * @author ztellman
 */
public class WordGraph {

  private final IList<Node> arena;
  private final Charset charset;
  private final long nodeCount;
  private final long edgeCount;
  private final long wordCount;

  WordGraph(IList<Node> arena, Charset charset, long nodeCount, long edgeCount, long wordCount) {
    this.arena = arena;
    this.charset = charset;
    this.nodeCount = nodeCount;
    this.edgeCount = edgeCount;
    this.wordCount = wordCount;
  }

  public Node root() {
    return arena.nth(0);
  }

  Node node(int id) {
    return arena.nth(id);
  }

  public Charset charset() {
    return charset;
  }

  /// queries

  public boolean lookup(String word) {
    return lookup(word.getBytes(charset));
  }

  /**
   * @return true if {@code word} was inserted into the graph
   */
  public boolean lookup(byte[] word) {
    int id = walk(arena, word);
    return id >= 0 && arena.nth(id).isTerminal();
  }

  public Optional<String> lookupPrefix(String prefix) {
    return lookupPrefix(prefix.getBytes(charset)).map(b -> new String(b, charset));
  }

  /**
   * Completes {@code prefix} by following the lowest-labeled edge out of each node until a terminal node is reached.
   *
   * @return the smallest word in the graph which starts with {@code prefix}, or nothing if there is no such word
   */
  public Optional<byte[]> lookupPrefix(byte[] prefix) {
    int id = walk(arena, prefix);
    if (id < 0) {
      return Optional.empty();
    }

    ByteArrayOutputStream word = new ByteArrayOutputStream();
    word.write(prefix, 0, prefix.length);

    Node curr = arena.nth(id);
    while (!curr.isTerminal()) {
      // only possible for the root of an empty graph
      if (curr.isLeaf()) {
        return Optional.empty();
      }
      word.write(curr.label(0));
      curr = arena.nth(curr.target(0));
    }

    return Optional.of(word.toByteArray());
  }

  /**
   * @return the number of distinct nodes, including the root
   */
  public long nodeCount() {
    return nodeCount;
  }

  public long edgeCount() {
    return edgeCount;
  }

  public long wordCount() {
    return wordCount;
  }

  /// export

  /**
   * @return the graph as a flat list of edges, in breadth-first order
   */
  public FlatWordGraph flatten() {
    IList<Node> nodes = reachable();

    // each node's edges are laid out contiguously, so its first edge index is known before any entry is built
    LinearMap<Integer, Integer> firstEdge = new LinearMap<>();
    int index = 0;
    for (Node n : nodes) {
      firstEdge.put(n.id, index);
      index += n.edgeCount();
    }

    LinearList<ArrayEntry> entries = new LinearList<>();
    for (Node n : nodes) {
      int last = n.edgeCount() - 1;
      for (int i = 0; i <= last; i++) {
        Node child = arena.nth(n.target(i));
        entries.addLast(new ArrayEntry(
                n.label(i),
                child.isTerminal(),
                i == last,
                child.isLeaf() ? 0 : firstEdge.get(child.id).get()));
      }
    }

    return new FlatWordGraph(entries, charset);
  }

  public void printDot(Appendable out) throws IOException {
    new DotWriter(out).write(this);
  }

  ///

  /**
   * @return every node reachable from the root, each exactly once, in breadth-first order
   */
  IList<Node> reachable() {
    LinearList<Node> nodes = LinearList.of(root());
    LinearSet<Integer> seen = LinearSet.of(0);

    for (int i = 0; i < nodes.size(); i++) {
      Node n = nodes.nth(i);
      for (int j = 0; j < n.edgeCount(); j++) {
        int target = n.target(j);
        if (!seen.contains(target)) {
          seen.add(target);
          nodes.addLast(arena.nth(target));
        }
      }
    }

    return nodes;
  }

  int locate(byte[] word) {
    return walk(arena, word);
  }

  /**
   * @return the id of the node reached by following {@code word} from the root, or -1 if it falls off the graph
   */
  static int walk(IList<Node> arena, byte[] word) {
    int id = 0;
    for (byte b : word) {
      id = arena.nth(id).child(b & 0xFF);
      if (id < 0) {
        return -1;
      }
    }
    return id;
  }
}
