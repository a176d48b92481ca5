package io.intellixity.arbor.query;

import io.intellixity.arbor.join.JoinKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Chained association traversal ({@code a.b.c}), optionally ending in an expression evaluated in the
 * context of the last association, e.g. {@code notable(Article).person.children.name}.
 * <p>
 * Without an endpoint a keypath is only meaningful as a join specification.
 */
public record KeyPath(List<JoinKey> keys, Expression endpoint) implements Expression {
  public KeyPath {
    keys = List.copyOf(keys == null ? List.of() : keys);
    if (keys.isEmpty()) throw new IllegalArgumentException("keypath requires at least one association");
  }

  public static KeyPath of(JoinKey... keys) {
    return new KeyPath(List.of(keys), null);
  }

  /** Parses {@code "a.b.c"} into plain association keys. */
  public static KeyPath parse(String dotted) {
    Objects.requireNonNull(dotted, "dotted");
    List<JoinKey> keys = new ArrayList<>();
    for (String part : dotted.split("\\.", -1)) {
      if (part.isBlank()) throw new IllegalArgumentException("Empty segment in keypath: '" + dotted + "'");
      keys.add(JoinKey.of(part.trim()));
    }
    return new KeyPath(keys, null);
  }

  public KeyPath then(String name) { return then(JoinKey.of(name)); }

  public KeyPath then(JoinKey key) {
    if (endpoint != null) throw new IllegalStateException("keypath already ends in " + endpoint);
    List<JoinKey> out = new ArrayList<>(keys);
    out.add(key);
    return new KeyPath(out, null);
  }

  public KeyPath attr(String attribute) { return to(new Attribute(attribute)); }

  /** Ends the path in an arbitrary expression scoped to the last association. */
  public KeyPath to(Expression endpoint) {
    Objects.requireNonNull(endpoint, "endpoint");
    if (this.endpoint != null) throw new IllegalStateException("keypath already ends in " + this.endpoint);
    return new KeyPath(keys, endpoint);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }

  @Override
  public String toString() {
    String path = keys.stream().map(JoinKey::toString).collect(Collectors.joining("."));
    return endpoint == null ? path : path + " -> " + endpoint;
  }
}
