package io.intellixity.arbor.join;

import io.intellixity.arbor.ast.SqlNode;
import io.intellixity.arbor.ast.TableRef;
import io.intellixity.arbor.authoring.AssociationDef;
import io.intellixity.arbor.authoring.EntityAuthoring;

import java.util.Objects;

/**
 * One physical table occurrence in a query: the root, or a joined association.
 * <p>
 * Created once per distinct {@link JoinPath} while a relation is built; immutable afterwards.
 */
public final class JoinNode {
  private final JoinPath path;
  private final EntityAuthoring entity;
  private final AssociationDef association;
  private final TableRef table;
  private final JoinNode parent;
  private final JoinType joinType;
  private final SqlNode on;
  private final JoinOrigin origin;

  JoinNode(JoinPath path, EntityAuthoring entity, AssociationDef association, TableRef table,
           JoinNode parent, JoinType joinType, SqlNode on, JoinOrigin origin) {
    this.path = Objects.requireNonNull(path, "path");
    this.entity = Objects.requireNonNull(entity, "entity");
    this.association = association;
    this.table = Objects.requireNonNull(table, "table");
    this.parent = parent;
    this.joinType = joinType;
    this.on = on;
    this.origin = Objects.requireNonNull(origin, "origin");
  }

  static JoinNode root(EntityAuthoring entity) {
    return new JoinNode(JoinPath.root(), entity, null, new TableRef(entity.table(), entity.table()),
        null, null, null, JoinOrigin.ROOT);
  }

  public JoinPath path() { return path; }
  public EntityAuthoring entity() { return entity; }
  /** Null for the root. */
  public AssociationDef association() { return association; }
  public TableRef table() { return table; }
  public String tableName() { return table.name(); }
  public String alias() { return table.alias(); }
  /** Null for the root. */
  public JoinNode parent() { return parent; }
  /** Null for the root. */
  public JoinType joinType() { return joinType; }
  /** ON condition; null for the root. */
  public SqlNode on() { return on; }
  public JoinOrigin origin() { return origin; }
  public boolean isRoot() { return parent == null; }

  @Override
  public String toString() {
    return "JoinNode[" + path + " -> " + table.name() + " " + table.alias() +
        (joinType == null ? "" : " " + joinType) + "]";
  }
}
