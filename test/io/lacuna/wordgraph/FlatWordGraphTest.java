package io.lacuna.wordgraph;

import io.lacuna.bifurcan.IList;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.TreeSet;

import static io.lacuna.wordgraph.WordGraphTest.graph;
import static io.lacuna.wordgraph.WordGraphTest.randomWord;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FlatWordGraphTest {

  @Test
  void layout() {
    FlatWordGraph flat = graph("a", "are", "as", "at").flatten();

    // 0: root -a-> A
    // 1..3: A -r-> AR, A -s-> leaf, A -t-> leaf
    // 4: AR -e-> leaf
    List<ArrayEntry> expected = List.of(
            new ArrayEntry('a', true, true, 1),
            new ArrayEntry('r', false, false, 4),
            new ArrayEntry('s', true, false, 0),
            new ArrayEntry('t', true, true, 0),
            new ArrayEntry('e', true, true, 0));

    assertEquals(expected, toList(flat.entries()));
  }

  @Test
  void sizeMatchesEdgeCount() {
    WordGraph graph = graph("cat", "cats", "dog", "doge", "dogs");
    assertEquals(graph.edgeCount(), graph.flatten().size());
  }

  @Test
  void lookup() {
    FlatWordGraph flat = graph("a", "are", "as", "at").flatten();

    assertTrue(flat.lookup("a"));
    assertTrue(flat.lookup("are"));
    assertTrue(flat.lookup("at"));
    assertFalse(flat.lookup("ar"));
    assertFalse(flat.lookup("b"));
    assertFalse(flat.lookup("ate"));
    assertFalse(flat.lookup(""));

    assertEquals(Optional.of("a"), flat.lookupPrefix(""));
    assertEquals(Optional.of("are"), flat.lookupPrefix("ar"));
    assertEquals(Optional.empty(), flat.lookupPrefix("x"));
  }

  @Test
  void emptyGraph() {
    FlatWordGraph flat = new WordGraphBuilder().finish().flatten();
    assertEquals(0, flat.size());
    assertFalse(flat.lookup("a"));
    assertEquals(Optional.empty(), flat.lookupPrefix(""));
  }

  @Test
  void reconstitutedFromEntries() {
    FlatWordGraph flat = graph("ant", "ants", "bat", "bats").flatten();
    List<ArrayEntry> exported = toList(flat.entries());

    FlatWordGraph copy = FlatWordGraph.of(exported);
    assertEquals(flat.size(), copy.size());
    assertTrue(copy.lookup("ants"));
    assertTrue(copy.lookup("bat"));
    assertFalse(copy.lookup("ba"));
  }

  @Test
  void invalidChildIndexesAreRejected() {
    assertThrows(IllegalArgumentException.class,
            () -> FlatWordGraph.of(List.of(new ArrayEntry('a', false, true, 5))));
    assertThrows(IllegalArgumentException.class,
            () -> FlatWordGraph.of(List.of(new ArrayEntry('a', false, true, 1))));

    // a node pointing at itself, and two nodes pointing at each other, would loop forever
    assertThrows(IllegalArgumentException.class, () -> FlatWordGraph.of(List.of(
            new ArrayEntry('a', false, true, 1),
            new ArrayEntry('b', false, true, 1))));
    assertThrows(IllegalArgumentException.class, () -> FlatWordGraph.of(List.of(
            new ArrayEntry('a', false, true, 1),
            new ArrayEntry('b', false, true, 2),
            new ArrayEntry('c', false, true, 1))));
  }

  @Test
  void sharedNodesMayPointBackwards() {
    // "a" and "ba" both lead to the node accepting just "b", which is laid out before "b"'s edges
    FlatWordGraph flat = graph("ab", "bab").flatten();
    ArrayEntry ba = flat.get(3);
    assertEquals('a', ba.label());
    assertTrue(ba.childIndex() < 3);

    FlatWordGraph copy = FlatWordGraph.of(toList(flat.entries()));
    assertTrue(copy.lookup("ab"));
    assertTrue(copy.lookup("bab"));
    assertFalse(copy.lookup("ba"));
  }

  @Test
  void sortedEntriesAreAccepted() {
    FlatWordGraph flat = FlatWordGraph.of(List.of(
            new ArrayEntry('a', false, true, 1),
            new ArrayEntry('b', true, true, 0)));
    assertTrue(flat.lookup("ab"));
    assertEquals(Optional.of("ab"), flat.lookupPrefix("a"));
  }

  @Test
  void agreesWithNodeLookup() {
    Random random = new Random(7);

    for (int trial = 0; trial < 100; trial++) {
      TreeSet<String> words = new TreeSet<>();
      int size = 1 + random.nextInt(60);
      while (words.size() < size) {
        words.add(randomWord(random, "xyz", 1 + random.nextInt(7)));
      }

      WordGraph graph = WordGraphs.fromSorted(words);
      FlatWordGraph flat = graph.flatten();

      for (String w : words) {
        assertTrue(flat.lookup(w), w);
      }
      for (int i = 0; i < 50; i++) {
        String w = randomWord(random, "wxyz", random.nextInt(9));
        assertEquals(graph.lookup(w), flat.lookup(w), w);
        assertEquals(graph.lookupPrefix(w), flat.lookupPrefix(w), w);
      }
    }
  }

  @Test
  void entryValidation() {
    assertThrows(IllegalArgumentException.class, () -> new ArrayEntry(256, false, false, 0));
    assertThrows(IllegalArgumentException.class, () -> new ArrayEntry(-1, false, false, 0));
    assertThrows(IllegalArgumentException.class, () -> new ArrayEntry('a', false, false, -3));
  }

  private static List<ArrayEntry> toList(IList<ArrayEntry> entries) {
    List<ArrayEntry> list = new ArrayList<>();
    entries.forEach(list::add);
    return list;
  }
}
