package io.intellixity.arbor.authoring;

import java.util.Objects;

/**
 * A declared association from one entity to another.
 *
 * <p>For {@link AssociationKind#BELONGS_TO} the foreign key is a column of the owning entity; for
 * {@code HAS_MANY}/{@code HAS_ONE} it is a column of the target. A polymorphic belongs-to has no fixed
 * target: the target type is supplied per join and matched against {@code foreignType}. A has-many declared
 * {@code as} an interface name is the inverse side of such a polymorphic association.</p>
 */
public record AssociationDef(
    String name,
    AssociationKind kind,
    /** Target entity type; null for polymorphic belongs-to. */
    String target,
    String foreignKey,
    /** Primary key on the referenced side; null means the entity's own primary key. */
    String primaryKey,
    boolean polymorphic,
    /** Polymorphic interface name for has-many/has-one {@code as}; null otherwise. */
    String as,
    /** Type discriminator column; set for polymorphic belongs-to and {@code as} associations. */
    String foreignType
) {
  public AssociationDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    if (name.isBlank()) throw new IllegalArgumentException("association name is blank");
    if (foreignKey == null || foreignKey.isBlank()) {
      throw new IllegalArgumentException("foreignKey is required for association: " + name);
    }
    if (polymorphic) {
      if (kind != AssociationKind.BELONGS_TO) {
        throw new IllegalArgumentException("only belongs_to associations can be polymorphic: " + name);
      }
      if (foreignType == null || foreignType.isBlank()) {
        throw new IllegalArgumentException("foreignType is required for polymorphic association: " + name);
      }
      target = null;
    } else if (target == null || target.isBlank()) {
      throw new IllegalArgumentException("target is required for association: " + name);
    }
    if (as != null && kind == AssociationKind.BELONGS_TO) {
      throw new IllegalArgumentException("'as' is not applicable to belongs_to association: " + name);
    }
  }

  public boolean isPolymorphicInverse() { return as != null; }

  public static AssociationDef belongsTo(String name, String target) {
    return belongsTo(name, target, name + "_id");
  }

  public static AssociationDef belongsTo(String name, String target, String foreignKey) {
    return new AssociationDef(name, AssociationKind.BELONGS_TO, target, foreignKey, null, false, null, null);
  }

  public static AssociationDef polymorphicBelongsTo(String name) {
    return new AssociationDef(name, AssociationKind.BELONGS_TO, null, name + "_id", null, true, null, name + "_type");
  }

  public static AssociationDef hasMany(String name, String target, String foreignKey) {
    return new AssociationDef(name, AssociationKind.HAS_MANY, target, foreignKey, null, false, null, null);
  }

  public static AssociationDef hasOne(String name, String target, String foreignKey) {
    return new AssociationDef(name, AssociationKind.HAS_ONE, target, foreignKey, null, false, null, null);
  }

  public static AssociationDef hasManyAs(String name, String target, String as) {
    return new AssociationDef(name, AssociationKind.HAS_MANY, target, as + "_id", null, false, as, as + "_type");
  }
}
