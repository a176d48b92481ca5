package io.intellixity.arbor.ast;

import java.util.List;
import java.util.Objects;

public record Function(String name, List<SqlNode> args) implements SqlNode {
  public Function {
    Objects.requireNonNull(name, "name");
    args = List.copyOf(args == null ? List.of() : args);
  }
}
