package io.intellixity.arbor.authoring;

public enum AssociationKind {
  BELONGS_TO,
  HAS_MANY,
  HAS_ONE;

  /** True when the foreign key lives on the owning (parent) side of the join. */
  public boolean ownsForeignKey() {
    return this == BELONGS_TO;
  }
}
