package io.intellixity.arbor.ast;

import java.util.Objects;

public record Aliased(SqlNode node, String alias) implements SqlNode {
  public Aliased {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(alias, "alias");
  }
}
