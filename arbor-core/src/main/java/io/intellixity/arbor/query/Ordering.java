package io.intellixity.arbor.query;

import java.util.Objects;

public record Ordering(Expression expression, Direction direction) implements Expression {
  public enum Direction { ASC, DESC }

  public Ordering {
    Objects.requireNonNull(expression, "expression");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
