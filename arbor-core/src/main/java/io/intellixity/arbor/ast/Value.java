package io.intellixity.arbor.ast;

/** Literal value; dialects either inline it or bind it. */
public record Value(Object value) implements SqlNode {
}
