package io.intellixity.arbor.ast;

import io.intellixity.arbor.relation.ComposedQuery;

import java.util.Objects;

public record Subquery(ComposedQuery query) implements SqlNode {
  public Subquery {
    Objects.requireNonNull(query, "query");
  }
}
