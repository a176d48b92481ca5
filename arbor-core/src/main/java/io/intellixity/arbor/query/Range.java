package io.intellixity.arbor.query;

/** Inclusive value range; lowers to BETWEEN. */
public record Range(Object lower, Object upper) {
  public Range {
    if (lower == null || upper == null) throw new IllegalArgumentException("Range requires non-null lower+upper");
  }
}
