package io.intellixity.arbor.ast;

import java.util.Objects;

public record Between(SqlNode operand, SqlNode lower, SqlNode upper, boolean negated) implements SqlNode {
  public Between {
    Objects.requireNonNull(operand, "operand");
    Objects.requireNonNull(lower, "lower");
    Objects.requireNonNull(upper, "upper");
  }
}
