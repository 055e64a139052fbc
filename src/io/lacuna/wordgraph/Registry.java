package io.lacuna.wordgraph;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearMap;

import java.util.Optional;

/**
 * Maps each signature seen so far to the single canonical node carrying it.
 */
class Registry {

  private final LinearMap<Signature, Integer> canonical = new LinearMap<>();

  /**
   * @return the id of a previously registered node equivalent to {@code node}, or the id of {@code node} itself if
   * it is the first of its kind, in which case it becomes the canonical node for its signature
   */
  int register(Node node) {
    Signature signature = node.signature();

    Optional<Integer> existing = canonical.get(signature);
    if (existing.isPresent()) {
      return existing.get();
    }

    canonical.put(signature, node.id);
    return node.id;
  }

  boolean contains(Node node) {
    return canonical.get(node.signature()).map(id -> id == node.id).orElse(false);
  }

  long size() {
    return canonical.size();
  }

  /**
   * @return the total number of outgoing edges across all canonical nodes
   */
  long edgeCount(IList<Node> arena) {
    long count = 0;
    for (Integer id : canonical.values()) {
      count += arena.nth(id).edgeCount();
    }
    return count;
  }
}
