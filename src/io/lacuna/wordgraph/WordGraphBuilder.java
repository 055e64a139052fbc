package io.lacuna.wordgraph;

import io.lacuna.bifurcan.LinearList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Builds a minimal acyclic automaton from words presented in strictly increasing byte order. Equivalent suffix
 * subtrees are merged as soon as the next word proves they can no longer change, so the graph never exists as a full
 * trie.
 * <p>
 * A builder is not thread-safe. Once {@link #finish()} is called it can no longer be modified, and the resulting
 * {@link WordGraph} may be shared freely.
 */
public class WordGraphBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(WordGraphBuilder.class);

  // an edge whose target hasn't been checked against the registry yet
  private static final class Unchecked {
    final int parent;
    final int child;
    final int label;

    Unchecked(int parent, int child, int label) {
      this.parent = parent;
      this.child = child;
      this.label = label;
    }
  }

  private final Charset charset;
  private final LinearList<Node> arena = new LinearList<>();
  private final LinearList<Unchecked> unchecked = new LinearList<>();
  private final Registry registry = new Registry();

  // the empty word sorts before everything, so it can never be inserted
  private byte[] previous = new byte[0];
  private long words = 0;
  private WordGraph graph = null;

  public WordGraphBuilder() {
    this(StandardCharsets.UTF_8);
  }

  /**
   * @param charset the encoding applied to words passed as strings
   */
  public WordGraphBuilder(Charset charset) {
    this.charset = charset;
    node();
  }

  /**
   * Equivalent to {@code insert(word.getBytes(charset))}.
   */
  public WordGraphBuilder insert(String word) {
    return insert(word.getBytes(charset));
  }

  /**
   * Adds {@code word} to the graph.
   *
   * @throws IllegalArgumentException if {@code word} is empty, or not strictly greater than the previously inserted
   * word
   * @throws IllegalStateException if the builder has already been finished
   */
  public WordGraphBuilder insert(byte[] word) {
    if (graph != null) {
      throw new IllegalStateException("cannot insert into a finished word graph");
    }

    if (Utils.compare(word, previous) <= 0) {
      throw new IllegalArgumentException("words must be inserted in strictly increasing order, but '"
              + new String(word, charset) + "' follows '" + new String(previous, charset) + "'");
    }

    int prefix = Utils.commonPrefix(word, previous);
    minimize(prefix);
    previous = word.clone();

    Node curr = unchecked.size() == 0 ? root() : arena.nth(unchecked.nth(unchecked.size() - 1).child);
    for (int i = prefix; i < word.length; i++) {
      int label = word[i] & 0xFF;
      Node next = node();
      curr.addEdge(label, next.id);
      unchecked.addLast(new Unchecked(curr.id, next.id, label));
      curr = next;
    }

    curr.terminal = true;
    words++;

    return this;
  }

  /**
   * Folds the remaining unchecked nodes into the registry, and returns the finished graph.
   *
   * @throws IllegalStateException if the builder has already been finished
   */
  public WordGraph finish() {
    if (graph != null) {
      throw new IllegalStateException("word graph has already been finished");
    }

    minimize(0);

    graph = new WordGraph(
            arena,
            charset,
            registry.size() + 1,
            registry.edgeCount(arena) + root().edgeCount(),
            words);

    LOGGER.debug("Finished word graph with {} words, {} nodes, {} edges ({} nodes allocated)",
            words, graph.nodeCount(), graph.edgeCount(), arena.size());

    return graph;
  }

  /**
   * @return true if {@code word} has been inserted so far
   */
  public boolean lookup(String word) {
    return lookup(word.getBytes(charset));
  }

  public boolean lookup(byte[] word) {
    int id = WordGraph.walk(arena, word);
    return id >= 0 && arena.nth(id).terminal;
  }

  public long wordCount() {
    return words;
  }

  public boolean isFinished() {
    return graph != null;
  }

  Registry registry() {
    return registry;
  }

  ///

  private Node root() {
    return arena.nth(0);
  }

  private Node node() {
    Node n = new Node((int) arena.size());
    arena.addLast(n);
    return n;
  }

  // pops unchecked edges deepest-first, so each child is canonical before its parent's signature is taken
  private void minimize(int depth) {
    while (unchecked.size() > depth) {
      Unchecked u = unchecked.popLast();
      Node child = arena.nth(u.child);

      int canonical = registry.register(child);
      if (canonical != child.id) {
        arena.nth(u.parent).setChild(u.label, canonical);
        if (LOGGER.isTraceEnabled()) {
          LOGGER.trace("Merged {} into node({})", child, canonical);
        }
      } else if (LOGGER.isTraceEnabled()) {
        LOGGER.trace("Registered {}", child);
      }
    }
  }
}
