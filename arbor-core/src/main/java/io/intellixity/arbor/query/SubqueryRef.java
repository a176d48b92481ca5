package io.intellixity.arbor.query;

import io.intellixity.arbor.relation.Relation;

import java.util.Objects;

/** A nested relation used in value position (e.g. the right side of IN). */
public record SubqueryRef(Relation relation) implements Expression {
  public SubqueryRef {
    Objects.requireNonNull(relation, "relation");
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
