package io.intellixity.arbor.query;

import io.intellixity.arbor.join.JoinKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nested condition/attribute mapping.
 *
 * <p>Keys are {@code String} or {@link JoinKey}. A {@code JoinKey}, or a {@code String} naming an association
 * of the current context, descends into that association; any other {@code String} is an attribute of the
 * current context. Values are nested maps, scalars, collections, {@link Range}s, relations or expressions.
 * Entry order is preserved; {@code null} values are allowed.</p>
 */
public record HashSpec(Map<Object, Object> entries) implements Expression {
  public HashSpec {
    if (entries == null || entries.isEmpty()) throw new IllegalArgumentException("hash spec is empty");
    Map<Object, Object> copy = new LinkedHashMap<>();
    for (var e : entries.entrySet()) {
      Object k = e.getKey();
      if (!(k instanceof String) && !(k instanceof JoinKey)) {
        throw new IllegalArgumentException("Hash key must be a String or JoinKey: " + k);
      }
      copy.put(k, e.getValue());
    }
    entries = Collections.unmodifiableMap(copy);
  }

  @SuppressWarnings("unchecked")
  public static HashSpec of(Map<?, ?> map) {
    return new HashSpec((Map<Object, Object>) map);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) { return visitor.visit(this, context); }
}
