package io.intellixity.arbor.query;

import io.intellixity.arbor.relation.Relation;

import java.util.List;

/**
 * Node of a caller-authored expression tree.
 *
 * <p>Trees are immutable. Visitors receive the join context an expression is being resolved against, so
 * the same tree can be contextualized under the root or under any joined association.</p>
 */
public interface Expression {
  <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);

  default BinaryOp eq(Object value) { return BinaryOp.of(Operator.EQ, this, value); }
  default BinaryOp ne(Object value) { return BinaryOp.of(Operator.NE, this, value); }
  default BinaryOp lt(Object value) { return BinaryOp.of(Operator.LT, this, value); }
  default BinaryOp le(Object value) { return BinaryOp.of(Operator.LE, this, value); }
  default BinaryOp gt(Object value) { return BinaryOp.of(Operator.GT, this, value); }
  default BinaryOp ge(Object value) { return BinaryOp.of(Operator.GE, this, value); }

  /** Pattern match ({@code LIKE}). */
  default BinaryOp matches(Object pattern) { return BinaryOp.of(Operator.MATCHES, this, pattern); }
  default BinaryOp doesNotMatch(Object pattern) { return BinaryOp.of(Operator.DOES_NOT_MATCH, this, pattern); }

  /** Membership in a literal collection, a {@link Range}, or a {@link Relation} subquery. */
  default BinaryOp in(Object values) { return BinaryOp.of(Operator.IN, this, values); }
  default BinaryOp notIn(Object values) { return BinaryOp.of(Operator.NOT_IN, this, values); }

  default BinaryOp plus(Object value) { return BinaryOp.of(Operator.PLUS, this, value); }
  default BinaryOp minus(Object value) { return BinaryOp.of(Operator.MINUS, this, value); }
  default BinaryOp times(Object value) { return BinaryOp.of(Operator.MULTIPLY, this, value); }
  default BinaryOp dividedBy(Object value) { return BinaryOp.of(Operator.DIVIDE, this, value); }

  /** Arbitrary infix operator, e.g. {@code op("||", "-suffix")}. */
  default BinaryOp op(String symbol, Object value) { return BinaryOp.custom(symbol, this, value); }

  default LogicalGroup and(Expression other) { return new LogicalGroup(Clause.AND, List.of(this, other)); }
  default LogicalGroup or(Expression other) { return new LogicalGroup(Clause.OR, List.of(this, other)); }
  default UnaryOp not() { return new UnaryOp(UnaryOp.Kind.NOT, this); }

  default Ordering asc() { return new Ordering(this, Ordering.Direction.ASC); }
  default Ordering desc() { return new Ordering(this, Ordering.Direction.DESC); }
  default Aliased as(String alias) { return new Aliased(this, alias); }
}
