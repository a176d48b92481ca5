package io.intellixity.arbor.join;

/** Which relation value first registered a join node. */
public enum JoinOrigin {
  ROOT,
  JOIN,
  /** Registered by {@code includes}; emitted only when the relation turns out to be eager loading. */
  INCLUDE,
  EAGER_LOAD
}
