package io.intellixity.arbor.ast;

import java.util.Objects;

public record Not(SqlNode operand) implements SqlNode {
  public Not {
    Objects.requireNonNull(operand, "operand");
  }
}
