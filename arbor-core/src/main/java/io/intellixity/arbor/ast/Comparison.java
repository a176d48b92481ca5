package io.intellixity.arbor.ast;

import io.intellixity.arbor.query.Operator;

import java.util.Objects;

/** Boolean comparison, pattern match, or membership test. */
public record Comparison(Operator operator, SqlNode left, SqlNode right) implements SqlNode {
  public Comparison {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    if (!operator.isPredicate()) throw new IllegalArgumentException("Not a predicate operator: " + operator);
  }
}
