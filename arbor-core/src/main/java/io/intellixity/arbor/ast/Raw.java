package io.intellixity.arbor.ast;

import java.util.Objects;

/** Caller-supplied SQL passed through verbatim. */
public record Raw(String sql) implements SqlNode {
  public Raw {
    Objects.requireNonNull(sql, "sql");
  }
}
