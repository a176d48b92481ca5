package io.intellixity.arbor.join;

import java.util.Objects;

/** One association step of a join path; the polymorphic type is part of the identity. */
public record PathSegment(String name, String polymorphicType) {
  public PathSegment {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public String toString() {
    return polymorphicType == null ? name : name + "(" + polymorphicType + ")";
  }
}
