package io.intellixity.arbor.visit;

import io.intellixity.arbor.ast.*;
import io.intellixity.arbor.join.ContextRegistry;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.query.*;
import io.intellixity.arbor.relation.Relation;

import java.util.*;

/**
 * Contextualizes WHERE/HAVING clauses.
 *
 * <p>Hash attribute entries become predicates: {@code null} tests for NULL, a collection is IN, a
 * {@link Range} is BETWEEN, a relation is an IN subquery, an expression is compared for equality and any
 * other value is an equality with a literal. Several entries of one hash are AND-combined.</p>
 */
public final class PredicateVisitor extends ExpressionContextualizer {
  public PredicateVisitor(ContextRegistry registry) {
    super(registry);
  }

  /** Contextualizes one stored WHERE/HAVING value: a hash, an expression or raw SQL. */
  public SqlNode accept(Object clause, JoinNode context) {
    Objects.requireNonNull(context, "context");
    if (clause instanceof String s) return new Raw(s);
    if (clause instanceof Map<?, ?> m) return visit(HashSpec.of(m), context);
    if (clause instanceof Attribute || clause instanceof Literal) {
      throw new IllegalArgumentException("A bare " + clause.getClass().getSimpleName() +
          " is not a condition: " + clause);
    }
    if (clause instanceof Expression e) return contextualize(e, context);
    throw new IllegalArgumentException("Unsupported condition: " + (clause == null ? "null" : clause.getClass().getName()));
  }

  @Override
  public SqlNode visit(HashSpec hash, JoinNode context) {
    List<SqlNode> out = new ArrayList<>();
    for (var e : hash.entries().entrySet()) {
      Object key = e.getKey();
      Object value = e.getValue();
      if (classifyKey(context, key) == KeyKind.ASSOCIATION) {
        out.add(nested(childOf(context, key), key, value));
      } else {
        out.add(leaf(column(context, (String) key), value, context));
      }
    }
    return out.size() == 1 ? out.get(0) : new Conjunction(Clause.AND, out);
  }

  private SqlNode nested(JoinNode child, Object key, Object value) {
    if (value instanceof HashSpec h) return visit(h, child);
    if (value instanceof Map<?, ?> m) return visit(HashSpec.of(m), child);
    if (value instanceof Expression e) return contextualize(e, child);
    throw new IllegalArgumentException("Association key '" + key + "' requires a nested hash or expression, got: " + value);
  }

  private SqlNode leaf(Column column, Object value, JoinNode context) {
    if (value == null) return new Comparison(Operator.EQ, column, new Value(null));
    if (value instanceof Range r) return new Between(column, new Value(r.lower()), new Value(r.upper()), false);
    if (value instanceof Relation r) return new Comparison(Operator.IN, column, new Subquery(membershipSubquery(r).build()));
    if (value instanceof Collection<?> || value instanceof Object[]) {
      return new Comparison(Operator.IN, column, valueOf(value));
    }
    if (value instanceof Map<?, ?> || value instanceof HashSpec) {
      throw new IllegalArgumentException("Attribute '" + column.name() + "' of '" + context.entity().type() +
          "' cannot take a nested hash");
    }
    if (value instanceof Expression e) return new Comparison(Operator.EQ, column, contextualize(e, context));
    return new Comparison(Operator.EQ, column, new Value(value));
  }
}
