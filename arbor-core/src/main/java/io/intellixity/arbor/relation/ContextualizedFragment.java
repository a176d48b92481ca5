package io.intellixity.arbor.relation;

import io.intellixity.arbor.ast.SqlNode;
import io.intellixity.arbor.join.JoinNode;

import java.util.Objects;

/** A contextualized clause and the join node it was authored against. */
public record ContextualizedFragment(JoinNode context, SqlNode node) {
  public ContextualizedFragment {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(node, "node");
  }
}
