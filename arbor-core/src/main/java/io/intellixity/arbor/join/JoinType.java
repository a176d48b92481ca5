package io.intellixity.arbor.join;

public enum JoinType {
  INNER,
  OUTER
}
