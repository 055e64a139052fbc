package io.lacuna.wordgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds word graphs from whole collections of words.
 */
public class WordGraphs {

  private static final Logger LOGGER = LoggerFactory.getLogger(WordGraphs.class);

  private WordGraphs() {
  }

  /**
   * Builds a graph from the newline-separated words read from {@code reader}, which may be in any order. Lines are
   * not deduplicated.
   *
   * @throws IOException if reading fails
   * @throws IllegalArgumentException if the same word appears on more than one line
   */
  public static WordGraph fromReader(Reader reader) throws IOException {
    List<String> words = new ArrayList<>();
    BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    for (String line = in.readLine(); line != null; line = in.readLine()) {
      words.add(line);
    }

    LOGGER.debug("Read {} words", words.size());
    return fromWords(words);
  }

  /**
   * Sorts {@code words} into the order a builder requires, then builds a graph from them.
   *
   * @throws IllegalArgumentException if {@code words} contains duplicates
   */
  public static WordGraph fromWords(Collection<String> words) {
    return fromWords(words, StandardCharsets.UTF_8);
  }

  public static WordGraph fromWords(Collection<String> words, Charset charset) {
    List<String> sorted = new ArrayList<>(words);
    sorted.sort(Utils.encodedOrder(charset));
    return fromSorted(sorted, charset);
  }

  /**
   * @throws IllegalArgumentException if {@code words} is not in strictly increasing order
   */
  public static WordGraph fromSorted(Iterable<String> words) {
    return fromSorted(words, StandardCharsets.UTF_8);
  }

  public static WordGraph fromSorted(Iterable<String> words, Charset charset) {
    WordGraphBuilder builder = new WordGraphBuilder(charset);
    words.forEach(builder::insert);
    return builder.finish();
  }
}
