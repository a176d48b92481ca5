package io.intellixity.arbor.query;

import io.intellixity.arbor.join.JoinKey;
import io.intellixity.arbor.relation.Relation;

import java.util.*;

/**
 * Factory methods for expression trees, standing in for the block DSL.
 *
 * <pre>
 *   attr("name").matches("Bob%").or(path("articles").attr("title").matches("Hello%"))
 *   hash("children", hash("name", "bob"))
 *   fn("max", attr("id")).as("max_id")
 * </pre>
 */
public final class Expressions {
  private Expressions() {}

  public static Attribute attr(String name) { return new Attribute(name); }

  public static Literal value(Object value) { return new Literal(value); }

  public static FunctionCall fn(String name, Object... args) {
    List<Expression> out = new ArrayList<>(args.length);
    for (Object a : args) out.add(operand(a));
    return new FunctionCall(name, out);
  }

  public static LogicalGroup and(Expression... elements) { return new LogicalGroup(Clause.AND, List.of(elements)); }

  public static LogicalGroup or(Expression... elements) { return new LogicalGroup(Clause.OR, List.of(elements)); }

  public static Grouping group(Expression expression) { return new Grouping(expression); }

  public static UnaryOp not(Expression expression) { return new UnaryOp(UnaryOp.Kind.NOT, expression); }

  public static UnaryOp negate(Expression expression) { return new UnaryOp(UnaryOp.Kind.NEGATE, expression); }

  public static SqlLiteral sql(String sql) { return new SqlLiteral(sql); }

  public static SubqueryRef subquery(Relation relation) { return new SubqueryRef(relation); }

  public static Range range(Object lower, Object upper) { return new Range(lower, upper); }

  public static JoinKey assoc(String name) { return JoinKey.of(name); }

  /** Polymorphic association step, e.g. {@code assoc("notable", "Article")}. */
  public static JoinKey assoc(String name, String polymorphicType) { return JoinKey.of(name, polymorphicType); }

  /** Keypath from names and/or {@link JoinKey}s. */
  public static KeyPath path(Object... keys) {
    List<JoinKey> out = new ArrayList<>(keys.length);
    for (Object k : keys) {
      if (k instanceof JoinKey jk) out.add(jk);
      else if (k instanceof String s) out.addAll(KeyPath.parse(s).keys());
      else throw new IllegalArgumentException("Unsupported keypath element: " + k);
    }
    return new KeyPath(out, null);
  }

  /** Hash spec from alternating keys and values. */
  public static HashSpec hash(Object... keysAndValues) {
    if (keysAndValues.length == 0 || keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("hash requires an even, non-zero number of arguments");
    }
    Map<Object, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      m.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return new HashSpec(m);
  }

  /** Wraps a right-hand value: expressions pass through, relations become subqueries, anything else a literal. */
  public static Expression operand(Object value) {
    if (value instanceof Expression e) return e;
    if (value instanceof Relation r) return new SubqueryRef(r);
    if (value instanceof Map<?, ?> m) return HashSpec.of(m);
    return new Literal(value);
  }
}
