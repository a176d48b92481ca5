package io.intellixity.arbor.visit;

import io.intellixity.arbor.ast.*;
import io.intellixity.arbor.join.ContextRegistry;
import io.intellixity.arbor.join.JoinKey;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.query.*;
import io.intellixity.arbor.relation.Relation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites an authored expression tree into a table-qualified {@link SqlNode} tree.
 *
 * <p>The visitor context is the {@link JoinNode} the expression is evaluated against. Attributes are
 * qualified with that node's table reference; keypaths and association hash keys move the context to an
 * already registered child node. Boolean combinators and groupings keep the context unchanged.</p>
 *
 * <p>Subclasses decide how hash specs are read (conditions or attribute lists).</p>
 */
public abstract class ExpressionContextualizer implements ExpressionVisitor<SqlNode, JoinNode> {
  protected final ContextRegistry registry;

  protected ExpressionContextualizer(ContextRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public ContextRegistry registry() { return registry; }

  public SqlNode contextualize(Expression expression, JoinNode context) {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(context, "context");
    return expression.accept(this, context);
  }

  /** Table reference columns of {@code context} are qualified with. */
  public TableRef contextualize(JoinNode context) {
    return context.table();
  }

  public KeyKind classifyKey(JoinNode context, Object key) {
    if (key instanceof JoinKey) return KeyKind.ASSOCIATION;
    if (key instanceof String s) {
      if (registry.isAssociation(context, s)) return KeyKind.ASSOCIATION;
      if (context.entity().hasColumn(s)) return KeyKind.ATTRIBUTE;
      throw new ResolutionException("'" + s + "' is neither an association nor an attribute of entity '" +
          context.entity().type() + "'");
    }
    throw new IllegalArgumentException("Unsupported hash key: " + (key == null ? "null" : key.getClass().getName()));
  }

  protected JoinNode childOf(JoinNode context, Object key) {
    JoinKey jk = (key instanceof JoinKey k) ? k : JoinKey.of((String) key);
    return registry.child(context, jk);
  }

  protected Column column(JoinNode context, String name) {
    if (!context.entity().hasColumn(name)) {
      throw new ResolutionException("Unknown attribute '" + name + "' on entity '" + context.entity().type() +
          "' (table '" + context.tableName() + "')");
    }
    return new Column(contextualize(context), name);
  }

  @Override
  public SqlNode visit(Attribute attribute, JoinNode context) {
    return column(context, attribute.name());
  }

  @Override
  public SqlNode visit(Literal literal, JoinNode context) {
    return valueOf(literal.value());
  }

  @Override
  public SqlNode visit(BinaryOp op, JoinNode context) {
    SqlNode left = op.left().accept(this, context);
    Operator operator = op.operator();

    if (operator == Operator.IN || operator == Operator.NOT_IN) {
      if (op.right() instanceof Literal l && l.value() instanceof Range r) {
        return new Between(left, new Value(r.lower()), new Value(r.upper()), operator == Operator.NOT_IN);
      }
      SqlNode right = (op.right() instanceof SubqueryRef sr)
          ? new Subquery(membershipSubquery(sr.relation()).build())
          : op.right().accept(this, context);
      if (right instanceof Value v) right = new ValueList(List.of(v));
      return new Comparison(operator, left, right);
    }

    SqlNode right = op.right().accept(this, context);
    if (operator.isPredicate()) return new Comparison(operator, left, right);
    return new Infix(op.symbol(), left, right);
  }

  @Override
  public SqlNode visit(UnaryOp op, JoinNode context) {
    SqlNode operand = op.operand().accept(this, context);
    return op.kind() == UnaryOp.Kind.NOT ? new Not(operand) : new Negate(operand);
  }

  @Override
  public SqlNode visit(FunctionCall call, JoinNode context) {
    List<SqlNode> args = new ArrayList<>(call.args().size());
    for (Expression a : call.args()) args.add(a.accept(this, context));
    return new Function(call.name(), args);
  }

  @Override
  public SqlNode visit(LogicalGroup group, JoinNode context) {
    List<SqlNode> nodes = new ArrayList<>(group.elements().size());
    for (Expression e : group.elements()) nodes.add(e.accept(this, context));
    return new Conjunction(group.clause(), nodes);
  }

  @Override
  public SqlNode visit(io.intellixity.arbor.query.Grouping grouping, JoinNode context) {
    return new io.intellixity.arbor.ast.Grouping(grouping.expression().accept(this, context));
  }

  @Override
  public SqlNode visit(SubqueryRef subquery, JoinNode context) {
    // Built independently: the nested relation gets its own registry and aliases.
    return new Subquery(subquery.relation().build());
  }

  @Override
  public SqlNode visit(KeyPath keyPath, JoinNode context) {
    if (keyPath.endpoint() == null) {
      throw new IllegalArgumentException("Keypath '" + keyPath + "' has no endpoint; add one with attr(...) or to(...)");
    }
    JoinNode node = context;
    for (JoinKey k : keyPath.keys()) node = registry.child(node, k);
    return keyPath.endpoint().accept(this, node);
  }

  @Override
  public SqlNode visit(Ordering ordering, JoinNode context) {
    return new Ordered(ordering.expression().accept(this, context), ordering.direction());
  }

  @Override
  public SqlNode visit(io.intellixity.arbor.query.Aliased aliased, JoinNode context) {
    return new io.intellixity.arbor.ast.Aliased(aliased.expression().accept(this, context), aliased.alias());
  }

  @Override
  public SqlNode visit(SqlLiteral sql, JoinNode context) {
    return new Raw(sql.sql());
  }

  /** A relation used for membership selects its primary key unless it already has a projection. */
  protected static Relation membershipSubquery(Relation r) {
    if (!r.selectValues().isEmpty()) return r;
    return r.select(Expressions.attr(r.entity().primaryKey()));
  }

  /** Plain value, collection or relation in value position. */
  protected SqlNode valueOf(Object value) {
    if (value instanceof Relation r) return new Subquery(r.build());
    if (value instanceof Collection<?> c) {
      List<SqlNode> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(valueOf(o));
      return new ValueList(out);
    }
    if (value instanceof Object[] arr) return valueOf(Arrays.asList(arr));
    return new Value(value);
  }
}
