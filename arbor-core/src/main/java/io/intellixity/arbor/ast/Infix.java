package io.intellixity.arbor.ast;

import java.util.Objects;

/** Non-boolean infix operation: arithmetic or a custom operator symbol. */
public record Infix(String operator, SqlNode left, SqlNode right) implements SqlNode {
  public Infix {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }
}
