package io.lacuna.wordgraph;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * A word graph laid out as a list of edges, which can be stored or embedded and then traversed without any node
 * objects. The root's edges begin at index 0, and every node's edges are contiguous and sorted by label, with the last
 * one flagged as the end of the list. To follow an edge, jump to its {@link ArrayEntry#childIndex()}.
 * <p>
 * The empty word is never a member, since a builder won't accept it.
 */
public class FlatWordGraph {

  private final IList<ArrayEntry> entries;
  private final Charset charset;

  FlatWordGraph(IList<ArrayEntry> entries, Charset charset) {
    this.entries = entries;
    this.charset = charset;
  }

  /**
   * Reconstitutes a flattened graph from previously exported entries, with words encoded as UTF-8.
   */
  public static FlatWordGraph of(Iterable<ArrayEntry> entries) {
    return of(entries, StandardCharsets.UTF_8);
  }

  /**
   * @throws IllegalArgumentException if an entry's {@code childIndex} is out of bounds, or the entries form a cycle
   */
  public static FlatWordGraph of(Iterable<ArrayEntry> entries, Charset charset) {
    LinearList<ArrayEntry> list = new LinearList<>();
    entries.forEach(list::addLast);

    for (long i = 0; i < list.size(); i++) {
      ArrayEntry e = list.nth(i);
      if (e.childIndex() >= list.size()) {
        throw new IllegalArgumentException("entry " + i + " points to " + e.childIndex()
                + ", but there are only " + list.size() + " entries");
      }
    }
    checkAcyclic(list);

    return new FlatWordGraph(list, charset);
  }

  public long size() {
    return entries.size();
  }

  public ArrayEntry get(long idx) {
    return entries.nth(idx);
  }

  public IList<ArrayEntry> entries() {
    return entries;
  }

  public boolean lookup(String word) {
    return lookup(word.getBytes(charset));
  }

  public boolean lookup(byte[] word) {
    ArrayEntry e = walk(word);
    return e != null && e.isTerminal();
  }

  public Optional<String> lookupPrefix(String prefix) {
    return lookupPrefix(prefix.getBytes(charset)).map(b -> new String(b, charset));
  }

  /**
   * @return the smallest word which starts with {@code prefix}, found by always taking a node's first edge
   */
  public Optional<byte[]> lookupPrefix(byte[] prefix) {
    boolean terminal;
    int next;

    if (prefix.length == 0) {
      terminal = false;
      next = entries.size() > 0 ? 0 : -1;
    } else {
      ArrayEntry e = walk(prefix);
      if (e == null) {
        return Optional.empty();
      }
      terminal = e.isTerminal();
      next = e.hasChildren() ? e.childIndex() : -1;
    }

    ByteArrayOutputStream word = new ByteArrayOutputStream();
    word.write(prefix, 0, prefix.length);

    while (!terminal) {
      if (next < 0) {
        return Optional.empty();
      }
      ArrayEntry e = entries.nth(next);
      word.write(e.label());
      terminal = e.isTerminal();
      next = e.hasChildren() ? e.childIndex() : -1;
    }

    return Optional.of(word.toByteArray());
  }

  ///

  private static final int ON_PATH = 1;
  private static final int DONE = 2;

  // depth-first from the root's edges; shared nodes may sit earlier in the list, so only a path back onto itself
  // is a cycle
  private static void checkAcyclic(IList<ArrayEntry> entries) {
    if (entries.size() == 0) {
      return;
    }

    LinearMap<Long, Integer> state = new LinearMap<>();
    // each element is {index of the node's first edge, number of its edges followed so far}
    LinearList<long[]> path = LinearList.of(new long[]{0, 0});
    state.put(0L, ON_PATH);

    while (path.size() > 0) {
      long[] top = path.nth(path.size() - 1);
      long idx = top[0] + top[1];

      if (idx >= entries.size() || (top[1] > 0 && entries.nth(idx - 1).isEndOfList())) {
        state.put(top[0], DONE);
        path.popLast();
        continue;
      }

      top[1]++;
      ArrayEntry e = entries.nth(idx);
      if (e.hasChildren()) {
        long child = e.childIndex();
        int s = state.get(child).orElse(0);
        if (s == ON_PATH) {
          throw new IllegalArgumentException("entry " + idx + " points back to " + child + ", forming a cycle");
        } else if (s == 0) {
          state.put(child, ON_PATH);
          path.addLast(new long[]{child, 0});
        }
      }
    }
  }

  // returns the entry for the last byte of the word, or null
  private ArrayEntry walk(byte[] word) {
    if (word.length == 0 || entries.size() == 0) {
      return null;
    }

    ArrayEntry e = null;
    int idx = 0;
    for (byte b : word) {
      if (e != null) {
        if (!e.hasChildren()) {
          return null;
        }
        idx = e.childIndex();
      }

      e = find(idx, b & 0xFF);
      if (e == null) {
        return null;
      }
    }
    return e;
  }

  private ArrayEntry find(int start, int label) {
    for (long i = start; i < entries.size(); i++) {
      ArrayEntry e = entries.nth(i);
      if (e.label() == label) {
        return e;
      } else if (e.isEndOfList() || e.label() > label) {
        return null;
      }
    }
    return null;
  }
}
