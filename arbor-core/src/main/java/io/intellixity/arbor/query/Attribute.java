package io.intellixity.arbor.query;

import java.util.Objects;

/** Reference to a column of whatever table the surrounding context resolves to. */
public record Attribute(String name) implements Expression {
  public Attribute {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("attribute name is blank");
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
