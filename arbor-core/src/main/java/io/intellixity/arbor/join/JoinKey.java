package io.intellixity.arbor.join;

import io.intellixity.arbor.query.Attribute;
import io.intellixity.arbor.query.KeyPath;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An authored association step: name, optional polymorphic type, optional explicit join type.
 * <p>
 * A null join type defers to the clause default (INNER for joins, OUTER for eager loads).
 */
public record JoinKey(String name, String polymorphicType, JoinType joinType) {
  public JoinKey {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("association name is blank");
    if (polymorphicType != null && polymorphicType.isBlank()) polymorphicType = null;
  }

  public static JoinKey of(String name) { return new JoinKey(name, null, null); }

  public static JoinKey of(String name, String polymorphicType) { return new JoinKey(name, polymorphicType, null); }

  public JoinKey inner() { return new JoinKey(name, polymorphicType, JoinType.INNER); }

  public JoinKey outer() { return new JoinKey(name, polymorphicType, JoinType.OUTER); }

  public PathSegment segment() { return new PathSegment(name, polymorphicType); }

  public KeyPath then(String next) { return then(JoinKey.of(next)); }

  public KeyPath then(JoinKey next) { return new KeyPath(List.of(this, next), null); }

  /** Keypath ending in an attribute of this association's table. */
  public KeyPath attr(String attribute) { return new KeyPath(List.of(this), new Attribute(attribute)); }

  @Override
  public String toString() {
    String s = segment().toString();
    return joinType == null ? s : s + "[" + joinType.name().toLowerCase(Locale.ROOT) + "]";
  }
}
