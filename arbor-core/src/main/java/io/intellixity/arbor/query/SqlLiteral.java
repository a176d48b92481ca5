package io.intellixity.arbor.query;

import java.util.Objects;

/** SQL text embedded verbatim; never contextualized. */
public record SqlLiteral(String sql) implements Expression {
  public SqlLiteral {
    Objects.requireNonNull(sql, "sql");
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
