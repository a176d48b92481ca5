package io.intellixity.arbor.query;

import java.util.Objects;

public record UnaryOp(Kind kind, Expression operand) implements Expression {
  public enum Kind { NOT, NEGATE }

  public UnaryOp {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
