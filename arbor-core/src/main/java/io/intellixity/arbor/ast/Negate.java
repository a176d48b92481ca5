package io.intellixity.arbor.ast;

import java.util.Objects;

public record Negate(SqlNode operand) implements SqlNode {
  public Negate {
    Objects.requireNonNull(operand, "operand");
  }
}
