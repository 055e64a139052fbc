package io.lacuna.wordgraph;

import java.io.IOException;

/**
 * Renders a word graph in Graphviz's DOT format. The root is drawn green and terminal nodes red.
 */
class DotWriter {

  private final Appendable out;

  DotWriter(Appendable out) {
    this.out = out;
  }

  void write(WordGraph graph) throws IOException {
    out.append("digraph g {\n");
    out.append("  node [shape=circle];\n");

    for (Node n : graph.reachable()) {
      String style = "";
      if (n.isTerminal()) {
        style = " style=filled fillcolor=\"#ff8080\"";
      } else if (n.id() == 0) {
        style = " style=filled fillcolor=\"#80ff80\"";
      }
      out.append("  N").append(String.valueOf(n.id()))
              .append(" [label=").append(String.valueOf(n.id())).append(style).append("];\n");

      for (int i = 0; i < n.edgeCount(); i++) {
        out.append("  N").append(String.valueOf(n.id()))
                .append(" -> N").append(String.valueOf(n.target(i)))
                .append(" [label=\"").append(escape(n.label(i))).append("\"];\n");
      }
    }

    out.append("}\n");
  }

  private static String escape(int label) {
    switch (label) {
      case '"':
        return "\\\"";
      case '\\':
        return "\\\\";
      default:
        return Utils.printable(label);
    }
  }
}
