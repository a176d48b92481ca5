package io.intellixity.arbor.ast;

import java.util.Objects;

public record Grouping(SqlNode node) implements SqlNode {
  public Grouping {
    Objects.requireNonNull(node, "node");
  }
}
