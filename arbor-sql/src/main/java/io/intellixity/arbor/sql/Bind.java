package io.intellixity.arbor.sql;

/** A positional bind value; placeholders are named {@code :b1}, {@code :b2}, ... in statement order. */
public record Bind(Object value) {
}
