package io.intellixity.arbor.ast;

import java.util.Objects;

/** Physical table plus the alias it is referenced by in one query. */
public record TableRef(String name, String alias) {
  public TableRef {
    Objects.requireNonNull(name, "name");
    alias = (alias == null || alias.isBlank()) ? name : alias;
  }

  public boolean aliased() { return !name.equals(alias); }
}
