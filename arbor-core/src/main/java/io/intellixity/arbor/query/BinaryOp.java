package io.intellixity.arbor.query;

import java.util.Objects;

public record BinaryOp(Operator operator, String symbol, Expression left, Expression right) implements Expression {
  public BinaryOp {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    if (operator == Operator.CUSTOM) {
      if (symbol == null || symbol.isBlank()) throw new IllegalArgumentException("custom operator requires a symbol");
    } else {
      symbol = operator.symbol();
    }
  }

  public static BinaryOp of(Operator operator, Expression left, Object right) {
    return new BinaryOp(operator, null, left, Expressions.operand(right));
  }

  public static BinaryOp custom(String symbol, Expression left, Object right) {
    return new BinaryOp(Operator.CUSTOM, symbol, left, Expressions.operand(right));
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
