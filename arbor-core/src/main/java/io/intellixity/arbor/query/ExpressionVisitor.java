package io.intellixity.arbor.query;

/**
 * One method per expression kind; implementing this interface is the exhaustive match over the tree.
 *
 * @param <R> result type
 * @param <C> context threaded through the walk (for contextualizers, the current join node)
 */
public interface ExpressionVisitor<R, C> {
  R visit(Attribute attribute, C context);
  R visit(Literal literal, C context);
  R visit(BinaryOp op, C context);
  R visit(UnaryOp op, C context);
  R visit(FunctionCall call, C context);
  R visit(LogicalGroup group, C context);
  R visit(Grouping grouping, C context);
  R visit(SubqueryRef subquery, C context);
  R visit(KeyPath keyPath, C context);
  R visit(HashSpec hash, C context);
  R visit(Ordering ordering, C context);
  R visit(Aliased aliased, C context);
  R visit(SqlLiteral sql, C context);
}
