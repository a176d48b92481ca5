package io.intellixity.arbor.join;

import io.intellixity.arbor.query.HashSpec;
import io.intellixity.arbor.query.KeyPath;

import java.util.*;

/**
 * Walks association join specifications depth first and registers one node per distinct path.
 *
 * <p>Accepted shapes, freely nested:</p>
 * <ul>
 *   <li>{@code "children"}: association name; {@code "children.parent"} is a keypath</li>
 *   <li>{@link JoinKey}: name with optional polymorphic type and join type</li>
 *   <li>{@link KeyPath} without an endpoint</li>
 *   <li>{@link Collection} or array of specs</li>
 *   <li>{@link Map} (or {@link HashSpec}) of association key to nested spec</li>
 * </ul>
 * Strings containing whitespace are raw SQL joins; they are collected up front by {@link #rawJoins(Object)}
 * and skipped during the walk. A raw join nested under a map key is rejected.
 */
public final class JoinResolver {
  private final ContextRegistry registry;

  public JoinResolver(ContextRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Registers every association named by {@code spec} beneath {@code parent}. */
  public List<JoinNode> resolve(Object spec, JoinNode parent, JoinType defaultType, JoinOrigin origin) {
    Objects.requireNonNull(parent, "parent");
    List<JoinNode> out = new ArrayList<>();
    walk(spec, parent, defaultType, origin, out, true);
    return out;
  }

  private void walk(Object spec, JoinNode parent, JoinType type, JoinOrigin origin, List<JoinNode> out, boolean listLevel) {
    if (spec == null) return;

    if (spec instanceof String s) {
      if (isRawJoin(s)) {
        if (listLevel) return;
        throw new IllegalArgumentException("Raw SQL join cannot be nested under association '" + parent.path() + "': " + s);
      }
      walkKey(s, parent, type, origin, out);
      return;
    }

    if (spec instanceof JoinKey || spec instanceof KeyPath) {
      walkKey(spec, parent, type, origin, out);
      return;
    }

    if (spec instanceof Collection<?> c) {
      for (Object o : c) walk(o, parent, type, origin, out, listLevel);
      return;
    }

    if (spec instanceof Object[] arr) {
      for (Object o : arr) walk(o, parent, type, origin, out, listLevel);
      return;
    }

    if (spec instanceof HashSpec h) {
      walk(h.entries(), parent, type, origin, out, listLevel);
      return;
    }

    if (spec instanceof Map<?, ?> m) {
      for (var e : m.entrySet()) {
        JoinNode node = walkKey(e.getKey(), parent, type, origin, out);
        walk(e.getValue(), node, type, origin, out, false);
      }
      return;
    }

    throw new IllegalArgumentException("Unsupported join spec: " + spec.getClass().getName());
  }

  /** Registers a single key (name, dotted keypath, JoinKey or KeyPath) and returns its deepest node. */
  private JoinNode walkKey(Object key, JoinNode parent, JoinType type, JoinOrigin origin, List<JoinNode> out) {
    List<JoinKey> keys;
    if (key instanceof JoinKey k) {
      keys = List.of(k);
    } else if (key instanceof KeyPath kp) {
      if (kp.endpoint() != null) {
        throw new IllegalArgumentException("Keypath with an endpoint is not a join spec: " + kp);
      }
      keys = kp.keys();
    } else if (key instanceof String s) {
      keys = KeyPath.parse(s).keys();
    } else {
      throw new IllegalArgumentException("Unsupported join key: " + (key == null ? "null" : key.getClass().getName()));
    }

    JoinNode node = parent;
    for (JoinKey k : keys) {
      node = registry.register(node, k, type, origin);
      out.add(node);
    }
    return node;
  }

  public static boolean isRawJoin(String spec) {
    for (int i = 0; i < spec.length(); i++) {
      if (Character.isWhitespace(spec.charAt(i))) return true;
    }
    return false;
  }

  /** Raw SQL join strings at the top level of {@code spec} (directly or inside top-level lists). */
  public static List<String> rawJoins(Object spec) {
    List<String> out = new ArrayList<>();
    collectRaw(spec, out);
    return out;
  }

  private static void collectRaw(Object spec, List<String> out) {
    if (spec instanceof String s) {
      if (isRawJoin(s)) out.add(s.trim());
    } else if (spec instanceof Collection<?> c) {
      for (Object o : c) collectRaw(o, out);
    } else if (spec instanceof Object[] arr) {
      for (Object o : arr) collectRaw(o, out);
    }
  }
}
