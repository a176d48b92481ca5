package io.intellixity.arbor.query;

import java.util.List;
import java.util.Objects;

/** AND/OR over its elements. Elements keep their authored order and nesting. */
public record LogicalGroup(Clause clause, List<Expression> elements) implements Expression {
  public LogicalGroup {
    Objects.requireNonNull(clause, "clause");
    elements = List.copyOf(elements == null ? List.of() : elements);
    if (elements.isEmpty()) throw new IllegalArgumentException(clause + " group requires at least one element");
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
