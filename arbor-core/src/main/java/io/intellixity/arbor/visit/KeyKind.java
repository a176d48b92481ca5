package io.intellixity.arbor.visit;

/** How a hash key is read in a given join context. */
public enum KeyKind {
  /** Descend into the named association. */
  ASSOCIATION,
  /** Column of the current context's table. */
  ATTRIBUTE
}
