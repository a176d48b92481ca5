package io.intellixity.arbor.query;

import java.util.Objects;

public record Aliased(Expression expression, String alias) implements Expression {
  public Aliased {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(alias, "alias");
    if (alias.isBlank()) throw new IllegalArgumentException("alias is blank");
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
