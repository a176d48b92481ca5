package io.intellixity.arbor.ast;

import java.util.ArrayList;
import java.util.List;

/** Several sibling nodes produced by one authored value (a hash or list in SELECT/GROUP/ORDER). */
public record NodeList(List<SqlNode> nodes) implements SqlNode {
  public NodeList {
    nodes = List.copyOf(nodes == null ? List.of() : nodes);
  }

  /** Expands nested lists in order; any other node becomes a single element. */
  public static List<SqlNode> flatten(SqlNode node) {
    List<SqlNode> out = new ArrayList<>();
    flattenInto(node, out);
    return out;
  }

  private static void flattenInto(SqlNode node, List<SqlNode> out) {
    if (node instanceof NodeList nl) {
      for (SqlNode n : nl.nodes()) flattenInto(n, out);
    } else if (node != null) {
      out.add(node);
    }
  }
}
