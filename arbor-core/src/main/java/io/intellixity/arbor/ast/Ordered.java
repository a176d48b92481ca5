package io.intellixity.arbor.ast;

import io.intellixity.arbor.query.Ordering;

import java.util.Objects;

public record Ordered(SqlNode node, Ordering.Direction direction) implements SqlNode {
  public Ordered {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(direction, "direction");
  }
}
