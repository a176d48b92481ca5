package io.intellixity.arbor.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class SqlNodes {
  private SqlNodes() {}

  /** Tables referenced by columns anywhere in {@code node}, excluding nested subqueries. */
  public static Set<TableRef> referencedTables(SqlNode node) {
    Set<TableRef> out = new LinkedHashSet<>();
    collect(node, out);
    return out;
  }

  /** Raw SQL snippets anywhere in {@code node}, excluding nested subqueries. */
  public static List<String> rawSql(SqlNode node) {
    List<String> out = new ArrayList<>();
    collectRaw(node, out);
    return out;
  }

  private static void collectRaw(SqlNode node, List<String> out) {
    if (node instanceof Raw r) {
      out.add(r.sql());
      return;
    }
    for (SqlNode child : children(node)) collectRaw(child, out);
  }

  private static List<SqlNode> children(SqlNode node) {
    if (node instanceof Comparison c) return List.of(c.left(), c.right());
    if (node instanceof Between b) return List.of(b.operand(), b.lower(), b.upper());
    if (node instanceof Infix i) return List.of(i.left(), i.right());
    if (node instanceof Not n) return List.of(n.operand());
    if (node instanceof Negate n) return List.of(n.operand());
    if (node instanceof Function f) return f.args();
    if (node instanceof Conjunction c) return c.nodes();
    if (node instanceof Grouping g) return List.of(g.node());
    if (node instanceof Ordered o) return List.of(o.node());
    if (node instanceof Aliased a) return List.of(a.node());
    if (node instanceof ValueList vl) return vl.values();
    if (node instanceof NodeList nl) return nl.nodes();
    return List.of();
  }

  private static void collect(SqlNode node, Set<TableRef> out) {
    if (node instanceof Column c) {
      out.add(c.table());
      return;
    }
    for (SqlNode child : children(node)) collect(child, out);
  }
}
