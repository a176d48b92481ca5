package io.intellixity.arbor.visit;

import io.intellixity.arbor.ast.NodeList;
import io.intellixity.arbor.ast.Raw;
import io.intellixity.arbor.ast.SqlNode;
import io.intellixity.arbor.join.ContextRegistry;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.query.Expression;
import io.intellixity.arbor.query.HashSpec;

import java.util.*;

/**
 * Contextualizes SELECT, GROUP BY and ORDER BY values.
 * <p>
 * Strings at the top level are raw SQL; inside a hash a string names an attribute of the association the
 * hash key selected. Hashes and lists produce several nodes, returned as a {@link NodeList}.
 */
public final class AttributeVisitor extends ExpressionContextualizer {
  public AttributeVisitor(ContextRegistry registry) {
    super(registry);
  }

  public SqlNode accept(Object value, JoinNode context) {
    Objects.requireNonNull(context, "context");
    if (value instanceof String s) return new Raw(s);
    if (value instanceof Map<?, ?> m) return visit(HashSpec.of(m), context);
    if (value instanceof Expression e) return contextualize(e, context);
    if (value instanceof Collection<?> c) {
      List<SqlNode> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(accept(o, context));
      return new NodeList(out);
    }
    if (value instanceof Object[] arr) return accept(Arrays.asList(arr), context);
    throw new IllegalArgumentException("Unsupported attribute spec: " + (value == null ? "null" : value.getClass().getName()));
  }

  /** Flattened form of {@link #accept(Object, JoinNode)}. */
  public List<SqlNode> acceptAll(Object value, JoinNode context) {
    return NodeList.flatten(accept(value, context));
  }

  @Override
  public SqlNode visit(HashSpec hash, JoinNode context) {
    List<SqlNode> out = new ArrayList<>();
    for (var e : hash.entries().entrySet()) {
      Object key = e.getKey();
      if (classifyKey(context, key) != KeyKind.ASSOCIATION) {
        throw new IllegalArgumentException("Attribute hash key '" + key + "' must name an association of '" +
            context.entity().type() + "'");
      }
      out.add(nested(childOf(context, key), e.getValue()));
    }
    return new NodeList(out);
  }

  private SqlNode nested(JoinNode child, Object value) {
    if (value instanceof String s) return column(child, s);
    if (value instanceof HashSpec h) return visit(h, child);
    if (value instanceof Map<?, ?> m) return visit(HashSpec.of(m), child);
    if (value instanceof Expression e) return contextualize(e, child);
    if (value instanceof Collection<?> c) {
      List<SqlNode> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(nested(child, o));
      return new NodeList(out);
    }
    if (value instanceof Object[] arr) return nested(child, Arrays.asList(arr));
    throw new IllegalArgumentException("Unsupported attribute spec under '" + child.path() + "': " + value);
  }
}
