package io.intellixity.arbor.ast;

import java.util.Objects;

public record Column(TableRef table, String name) implements SqlNode {
  public Column {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(name, "name");
  }
}
