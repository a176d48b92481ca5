package io.intellixity.arbor.query;

import java.util.Objects;

/** Explicit parentheses as written by the caller. */
public record Grouping(Expression expression) implements Expression {
  public Grouping {
    Objects.requireNonNull(expression, "expression");
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
