package io.intellixity.arbor.authoring;

public interface AuthoringRegistry {
  /** Returns the authoring for {@code type}; throws {@link IllegalArgumentException} when unknown. */
  EntityAuthoring getEntityAuthoring(String type);

  boolean contains(String type);
}
