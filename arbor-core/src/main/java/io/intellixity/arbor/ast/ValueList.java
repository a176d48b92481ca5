package io.intellixity.arbor.ast;

import java.util.List;

public record ValueList(List<SqlNode> values) implements SqlNode {
  public ValueList {
    values = List.copyOf(values == null ? List.of() : values);
  }
}
