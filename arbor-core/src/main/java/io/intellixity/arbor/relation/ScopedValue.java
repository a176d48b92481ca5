package io.intellixity.arbor.relation;

import io.intellixity.arbor.join.JoinPath;

import java.util.Objects;

/** A stored clause value plus the join path it was authored against (root unless merged in). */
record ScopedValue(JoinPath scope, Object value) {
  ScopedValue {
    Objects.requireNonNull(scope, "scope");
  }

  static ScopedValue root(Object value) {
    return new ScopedValue(JoinPath.root(), value);
  }

  ScopedValue under(JoinPath prefix) {
    return new ScopedValue(prefix.concat(scope), value);
  }
}
