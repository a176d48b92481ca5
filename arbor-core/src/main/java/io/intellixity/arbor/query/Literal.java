package io.intellixity.arbor.query;

public record Literal(Object value) implements Expression {
  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
