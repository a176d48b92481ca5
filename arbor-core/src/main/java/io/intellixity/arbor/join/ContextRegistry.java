package io.intellixity.arbor.join;

import io.intellixity.arbor.ast.SqlNode;
import io.intellixity.arbor.ast.TableRef;
import io.intellixity.arbor.authoring.AssociationDef;
import io.intellixity.arbor.authoring.AuthoringRegistry;
import io.intellixity.arbor.authoring.EntityAuthoring;
import io.intellixity.arbor.query.ResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Join-path to table mapping for one query build.
 *
 * <p>Owns the join nodes and the alias counter. A registry is created per build, written by a single
 * builder, and discarded afterwards; it is never shared between builds or threads.</p>
 */
public final class ContextRegistry {
  private static final Logger log = LoggerFactory.getLogger(ContextRegistry.class);

  private final AuthoringRegistry authoring;
  private final JoinNode root;
  private final Map<JoinPath, JoinNode> nodes = new LinkedHashMap<>();
  private final List<String> rawJoins;
  private final TableAliases aliases;

  public ContextRegistry(AuthoringRegistry authoring, EntityAuthoring rootEntity, List<String> rawJoins,
                         int tableAliasLength) {
    this.authoring = Objects.requireNonNull(authoring, "authoring");
    this.root = JoinNode.root(Objects.requireNonNull(rootEntity, "rootEntity"));
    this.rawJoins = List.copyOf(rawJoins == null ? List.of() : rawJoins);
    this.aliases = new TableAliases(rootEntity.table(), this.rawJoins, tableAliasLength);
  }

  public JoinNode root() { return root; }

  /** Association join nodes in registration order (root excluded). */
  public List<JoinNode> joinNodes() { return List.copyOf(nodes.values()); }

  public List<String> rawJoins() { return rawJoins; }

  public AuthoringRegistry authoring() { return authoring; }

  /**
   * Returns the node for {@code parent.path + key}, creating it when absent.
   * <p>
   * The join type of the first registration wins; later conflicting requests are ignored.
   */
  public JoinNode register(JoinNode parent, JoinKey key, JoinType defaultType, JoinOrigin origin) {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(key, "key");
    JoinType requested = key.joinType() != null ? key.joinType() : Objects.requireNonNull(defaultType, "defaultType");

    AssociationDef assoc = associationOf(parent, key);
    JoinPath path = parent.path().child(segmentOf(assoc, key));
    JoinNode existing = nodes.get(path);
    if (existing != null) {
      if (existing.joinType() != requested) {
        log.debug("arbor.join_type_conflict path={} kept={} ignored={}", path, existing.joinType(), requested);
      }
      return existing;
    }

    EntityAuthoring target = targetOf(parent, assoc, key.polymorphicType());
    String alias = aliases.aliasFor(target.table(), assoc.name(), parent.tableName());
    TableRef table = new TableRef(target.table(), alias);
    SqlNode on = JoinConditions.on(assoc, parent, target, table);

    JoinNode node = new JoinNode(path, target, assoc, table, parent, requested, on, origin);
    nodes.put(path, node);
    log.debug("arbor.join path={} table={} alias={} joinType={} origin={}",
        path, table.name(), table.alias(), requested, origin);
    return node;
  }

  public Optional<JoinNode> find(JoinPath path) {
    if (path.isRoot()) return Optional.of(root);
    return Optional.ofNullable(nodes.get(path));
  }

  public JoinNode lookup(JoinPath path) {
    return find(path).orElseThrow(() -> new ResolutionException(
        "Association path '" + path + "' is not joined for entity '" + root.entity().type() +
            "'; add it with joins, includes or eagerLoad"));
  }

  /** Resolves an already registered association step below {@code context}. */
  public JoinNode child(JoinNode context, JoinKey key) {
    Objects.requireNonNull(context, "context");
    AssociationDef assoc = associationOf(context, key);
    if (assoc.polymorphic()) {
      return resolvePolymorphic(context.path(), key.name(), key.polymorphicType());
    }
    return lookup(context.path().child(segmentOf(assoc, key)));
  }

  public JoinNode resolvePolymorphic(JoinPath parentPath, String name, String type) {
    Objects.requireNonNull(type, "type");
    return lookup(parentPath.child(new PathSegment(name, type)));
  }

  /** True when {@code name} is an association of the entity joined at {@code context}. */
  public boolean isAssociation(JoinNode context, String name) {
    return context.entity().association(name).isPresent();
  }

  private AssociationDef associationOf(JoinNode parent, JoinKey key) {
    AssociationDef assoc = parent.entity().association(key.name()).orElseThrow(() -> new ResolutionException(
        "Unknown association '" + key.name() + "' on entity '" + parent.entity().type() + "'"));
    if (assoc.polymorphic() && key.polymorphicType() == null) {
      throw new ResolutionException("Polymorphic association '" + key.name() + "' on entity '" +
          parent.entity().type() + "' requires a type, e.g. " + key.name() + "(SomeType)");
    }
    if (!assoc.polymorphic() && key.polymorphicType() != null && !key.polymorphicType().equals(assoc.target())) {
      throw new ResolutionException("Association '" + key.name() + "' on entity '" + parent.entity().type() +
          "' is not polymorphic; type '" + key.polymorphicType() + "' is not applicable");
    }
    return assoc;
  }

  // A type argument only distinguishes paths of polymorphic associations.
  private static PathSegment segmentOf(AssociationDef assoc, JoinKey key) {
    return assoc.polymorphic() ? key.segment() : new PathSegment(key.name(), null);
  }

  private EntityAuthoring targetOf(JoinNode parent, AssociationDef assoc, String polymorphicType) {
    String type = assoc.polymorphic() ? polymorphicType : assoc.target();
    if (!authoring.contains(type)) {
      throw new ResolutionException("Unknown target type '" + type + "' for association '" + assoc.name() +
          "' on entity '" + parent.entity().type() + "'");
    }
    return authoring.getEntityAuthoring(type);
  }
}
