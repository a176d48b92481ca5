package io.intellixity.arbor.query;

import java.util.List;
import java.util.Objects;

public record FunctionCall(String name, List<Expression> args) implements Expression {
  public FunctionCall {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("function name is blank");
    args = List.copyOf(args == null ? List.of() : args);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
