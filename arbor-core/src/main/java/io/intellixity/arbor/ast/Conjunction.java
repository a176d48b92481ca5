package io.intellixity.arbor.ast;

import io.intellixity.arbor.query.Clause;

import java.util.List;
import java.util.Objects;

public record Conjunction(Clause clause, List<SqlNode> nodes) implements SqlNode {
  public Conjunction {
    Objects.requireNonNull(clause, "clause");
    nodes = List.copyOf(nodes == null ? List.of() : nodes);
  }
}
