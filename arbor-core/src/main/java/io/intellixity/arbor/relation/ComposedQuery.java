package io.intellixity.arbor.relation;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.arbor.ast.Conjunction;
import io.intellixity.arbor.ast.SqlNode;
import io.intellixity.arbor.ast.TableRef;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.query.Clause;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output of one relation build: the emitted joins and every clause fully table-qualified, ready for a
 * SQL dialect to lower.
 *
 * @param joins     association joins to emit, in registration order
 * @param rawJoins  caller-supplied SQL joins, emitted after the association joins
 * @param preloads  association specs to be loaded by separate queries
 * @param eagerLoading true when included associations are loaded through the emitted joins
 * @param page      null when unpaged
 */
@JsonSerialize(using = ComposedQueryJsonSerializer.class)
public record ComposedQuery(
    String rootType,
    TableRef root,
    List<JoinNode> joins,
    List<String> rawJoins,
    List<ContextualizedFragment> wheres,
    List<ContextualizedFragment> havings,
    List<ContextualizedFragment> groups,
    List<ContextualizedFragment> orders,
    List<ContextualizedFragment> selects,
    List<Object> preloads,
    boolean eagerLoading,
    OffsetPage page
) {
  public ComposedQuery {
    Objects.requireNonNull(rootType, "rootType");
    Objects.requireNonNull(root, "root");
    joins = joins == null ? List.of() : List.copyOf(joins);
    rawJoins = rawJoins == null ? List.of() : List.copyOf(rawJoins);
    wheres = wheres == null ? List.of() : List.copyOf(wheres);
    havings = havings == null ? List.of() : List.copyOf(havings);
    groups = groups == null ? List.of() : List.copyOf(groups);
    orders = orders == null ? List.of() : List.copyOf(orders);
    selects = selects == null ? List.of() : List.copyOf(selects);
    preloads = preloads == null ? List.of() : List.copyOf(preloads);
  }

  /** WHERE fragments AND-combined; null when there are none. */
  public SqlNode wherePredicate() {
    return combine(wheres);
  }

  /** HAVING fragments AND-combined; null when there are none. */
  public SqlNode havingPredicate() {
    return combine(havings);
  }

  private static SqlNode combine(List<ContextualizedFragment> fragments) {
    if (fragments.isEmpty()) return null;
    if (fragments.size() == 1) return fragments.get(0).node();
    List<SqlNode> nodes = new ArrayList<>(fragments.size());
    for (ContextualizedFragment f : fragments) nodes.add(f.node());
    return new Conjunction(Clause.AND, nodes);
  }
}
