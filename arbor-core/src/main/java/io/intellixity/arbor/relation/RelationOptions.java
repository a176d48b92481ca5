package io.intellixity.arbor.relation;

/**
 * Build settings shared by every relation derived from one {@link Relation#from} call.
 *
 * @param tableAliasLength maximum length of generated table aliases (identifier limit of the target database)
 */
public record RelationOptions(int tableAliasLength) {
  public static final int DEFAULT_TABLE_ALIAS_LENGTH = 64;

  public RelationOptions {
    if (tableAliasLength < 4) throw new IllegalArgumentException("tableAliasLength must be >= 4");
  }

  public static RelationOptions defaults() {
    return new RelationOptions(DEFAULT_TABLE_ALIAS_LENGTH);
  }
}
