package io.intellixity.arbor.join;

import io.intellixity.arbor.ast.Column;
import io.intellixity.arbor.ast.Comparison;
import io.intellixity.arbor.ast.Conjunction;
import io.intellixity.arbor.ast.SqlNode;
import io.intellixity.arbor.ast.TableRef;
import io.intellixity.arbor.ast.Value;
import io.intellixity.arbor.authoring.AssociationDef;
import io.intellixity.arbor.authoring.EntityAuthoring;
import io.intellixity.arbor.query.Clause;
import io.intellixity.arbor.query.Operator;

import java.util.List;

/** Builds ON conditions from association key metadata. */
final class JoinConditions {
  private JoinConditions() {}

  static SqlNode on(AssociationDef assoc, JoinNode parent, EntityAuthoring target, TableRef child) {
    TableRef owner = parent.table();
    if (assoc.kind().ownsForeignKey()) {
      // child.pk = owner.fk [AND owner.type = 'Target']
      String pk = assoc.primaryKey() != null ? assoc.primaryKey() : target.primaryKey();
      SqlNode keys = new Comparison(Operator.EQ, new Column(child, pk), new Column(owner, assoc.foreignKey()));
      if (!assoc.polymorphic()) return keys;
      SqlNode type = new Comparison(Operator.EQ, new Column(owner, assoc.foreignType()), new Value(target.type()));
      return new Conjunction(Clause.AND, List.of(keys, type));
    }

    // child.fk = owner.pk [AND child.type = 'Owner']
    String pk = assoc.primaryKey() != null ? assoc.primaryKey() : parent.entity().primaryKey();
    SqlNode keys = new Comparison(Operator.EQ, new Column(child, assoc.foreignKey()), new Column(owner, pk));
    if (!assoc.isPolymorphicInverse()) return keys;
    SqlNode type = new Comparison(Operator.EQ, new Column(child, assoc.foreignType()), new Value(parent.entity().type()));
    return new Conjunction(Clause.AND, List.of(keys, type));
  }
}
