package io.intellixity.arbor.sql.dialect;

import io.intellixity.arbor.ast.*;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.join.JoinType;
import io.intellixity.arbor.query.Clause;
import io.intellixity.arbor.query.Operator;
import io.intellixity.arbor.query.Ordering;
import io.intellixity.arbor.relation.ComposedQuery;
import io.intellixity.arbor.relation.ContextualizedFragment;
import io.intellixity.arbor.relation.OffsetPage;
import io.intellixity.arbor.sql.Bind;
import io.intellixity.arbor.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generic SQL rendering for composed queries.
 *
 * <p>Statement shape:</p>
 * <pre>
 * SELECT &lt;selects | "root".*&gt; FROM "table" &lt;association joins&gt; &lt;raw joins&gt;
 *   [WHERE ..] [GROUP BY ..] [HAVING ..] [ORDER BY ..] &lt;page&gt;
 * </pre>
 *
 * Repeated WHERE/HAVING fragments are AND-combined; raw SQL fragments are parenthesized. An OR nested in
 * an AND is parenthesized; explicit groupings always are. Dialects override identifier quoting, paging
 * and operator spelling.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  private static final Logger log = LoggerFactory.getLogger(AbstractSqlDialect.class);

  protected static final class RenderCtx {
    private final boolean inline;
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();

    private RenderCtx(boolean inline) {
      this.inline = inline;
    }

    public String add(Object value) {
      binds.add(new Bind(value));
      return ":b" + (n++);
    }

    public boolean inline() { return inline; }
  }

  @Override
  public final SqlStatement render(ComposedQuery query) {
    Objects.requireNonNull(query, "query");
    RenderCtx ctx = new RenderCtx(false);
    String sql = renderSelect(query, ctx);
    log.debug("arbor.sql dialect={} op=select type={} binds={}", id(), query.rootType(), ctx.binds.size());
    return new SqlStatement(sql, ctx.binds);
  }

  @Override
  public final String toSql(ComposedQuery query) {
    Objects.requireNonNull(query, "query");
    String sql = renderSelect(query, new RenderCtx(true));
    log.debug("arbor.sql dialect={} op=to_sql type={}", id(), query.rootType());
    return sql;
  }

  @Override
  public final SqlStatement renderCount(ComposedQuery query) {
    Objects.requireNonNull(query, "query");
    RenderCtx ctx = new RenderCtx(false);
    String sql = "SELECT COUNT(1) FROM (" + renderSelect(query, ctx) + ") arbor_count";
    log.debug("arbor.sql dialect={} op=count type={} binds={}", id(), query.rootType(), ctx.binds.size());
    return new SqlStatement(sql, ctx.binds);
  }

  protected String renderSelect(ComposedQuery q, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder("SELECT ");
    if (q.selects().isEmpty()) {
      sql.append(quoteIdent(q.root().alias())).append(".*");
    } else {
      sql.append(renderList(q.selects(), ctx));
    }
    sql.append(" FROM ").append(tableSql(q.root()));

    for (JoinNode j : q.joins()) {
      sql.append(j.joinType() == JoinType.OUTER ? " LEFT OUTER JOIN " : " INNER JOIN ")
          .append(tableSql(j.table()))
          .append(" ON ")
          .append(renderNode(j.on(), ctx));
    }
    for (String raw : q.rawJoins()) sql.append(' ').append(raw);

    if (!q.wheres().isEmpty()) sql.append(" WHERE ").append(renderConditions(q.wheres(), ctx));
    if (!q.groups().isEmpty()) sql.append(" GROUP BY ").append(renderList(q.groups(), ctx));
    if (!q.havings().isEmpty()) sql.append(" HAVING ").append(renderConditions(q.havings(), ctx));
    if (!q.orders().isEmpty()) sql.append(" ORDER BY ").append(renderList(q.orders(), ctx));

    String out = sql.toString();
    if (q.page() != null) out = applyOffsetPage(out, q.page());
    return out;
  }

  /** Default is no paging; dialects override. */
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql;
  }

  protected abstract String quoteIdent(String ident);

  protected String operatorSql(Operator op) {
    return op.symbol();
  }

  protected String tableSql(TableRef t) {
    String name = quoteIdent(t.name());
    return t.aliased() ? name + " " + quoteIdent(t.alias()) : name;
  }

  private String renderConditions(List<ContextualizedFragment> fragments, RenderCtx ctx) {
    List<String> parts = new ArrayList<>(fragments.size());
    boolean several = fragments.size() > 1;
    for (ContextualizedFragment f : fragments) {
      SqlNode n = f.node();
      if (n instanceof Raw r) parts.add("(" + r.sql() + ")");
      else parts.add(several ? operand(n, Clause.AND, ctx) : renderNode(n, ctx));
    }
    return String.join(" AND ", parts);
  }

  private String renderList(List<ContextualizedFragment> fragments, RenderCtx ctx) {
    List<String> parts = new ArrayList<>(fragments.size());
    for (ContextualizedFragment f : fragments) parts.add(renderNode(f.node(), ctx));
    return String.join(", ", parts);
  }

  protected String renderNode(SqlNode n, RenderCtx ctx) {
    if (n == null) return "";

    if (n instanceof Column c) {
      return quoteIdent(c.table().alias()) + "." + quoteIdent(c.name());
    }

    if (n instanceof Value v) {
      return valueSql(v.value(), ctx);
    }

    if (n instanceof ValueList vl) {
      return "(" + join(vl.values(), ctx) + ")";
    }

    if (n instanceof NodeList nl) {
      return join(nl.nodes(), ctx);
    }

    if (n instanceof Comparison c) {
      return comparisonSql(c, ctx);
    }

    if (n instanceof Between b) {
      return renderNode(b.operand(), ctx) + (b.negated() ? " NOT BETWEEN " : " BETWEEN ") +
          renderNode(b.lower(), ctx) + " AND " + renderNode(b.upper(), ctx);
    }

    if (n instanceof Infix i) {
      return arithmeticOperand(i.left(), ctx) + " " + i.operator() + " " + arithmeticOperand(i.right(), ctx);
    }

    if (n instanceof Negate x) {
      return "-" + arithmeticOperand(x.operand(), ctx);
    }

    if (n instanceof Not x) {
      return "NOT (" + renderNode(x.operand(), ctx) + ")";
    }

    if (n instanceof Conjunction c) {
      if (c.nodes().isEmpty()) return c.clause() == Clause.AND ? "TRUE" : "FALSE";
      if (c.nodes().size() == 1) return renderNode(c.nodes().get(0), ctx);
      List<String> parts = new ArrayList<>(c.nodes().size());
      for (SqlNode child : c.nodes()) parts.add(operand(child, c.clause(), ctx));
      return String.join(c.clause() == Clause.OR ? " OR " : " AND ", parts);
    }

    if (n instanceof Grouping g) {
      return "(" + renderNode(g.node(), ctx) + ")";
    }

    if (n instanceof Function f) {
      return f.name() + "(" + join(f.args(), ctx) + ")";
    }

    if (n instanceof Ordered o) {
      return renderNode(o.node(), ctx) + (o.direction() == Ordering.Direction.DESC ? " DESC" : " ASC");
    }

    if (n instanceof Aliased a) {
      return renderNode(a.node(), ctx) + " AS " + a.alias();
    }

    if (n instanceof Raw r) {
      return r.sql();
    }

    if (n instanceof Subquery s) {
      return "(" + renderSelect(s.query(), ctx) + ")";
    }

    throw new IllegalArgumentException("Unsupported SqlNode for dialect " + id() + ": " + n.getClass().getName());
  }

  private String comparisonSql(Comparison c, RenderCtx ctx) {
    String left = renderNode(c.left(), ctx);
    Operator op = c.operator();

    if (c.right() instanceof Value v && v.value() == null) {
      if (op == Operator.EQ) return left + " IS NULL";
      if (op == Operator.NE) return left + " IS NOT NULL";
    }

    if (op == Operator.IN || op == Operator.NOT_IN) {
      SqlNode right = c.right();
      if (right instanceof ValueList vl) {
        if (vl.values().isEmpty()) return op == Operator.IN ? "FALSE" : "TRUE";
        return left + " " + operatorSql(op) + " " + renderNode(vl, ctx);
      }
      if (right instanceof Subquery) return left + " " + operatorSql(op) + " " + renderNode(right, ctx);
      return left + " " + operatorSql(op) + " (" + renderNode(right, ctx) + ")";
    }

    return left + " " + operatorSql(op) + " " + renderNode(c.right(), ctx);
  }

  // OR inside AND needs parentheses; AND binds tighter so the reverse does not.
  private String operand(SqlNode child, Clause parent, RenderCtx ctx) {
    String sql = renderNode(child, ctx);
    if (parent == Clause.AND && child instanceof Conjunction c && c.clause() == Clause.OR && c.nodes().size() > 1) {
      return "(" + sql + ")";
    }
    return sql;
  }

  private String arithmeticOperand(SqlNode child, RenderCtx ctx) {
    String sql = renderNode(child, ctx);
    if (child instanceof Infix || child instanceof Conjunction || child instanceof Comparison) return "(" + sql + ")";
    return sql;
  }

  private String join(List<SqlNode> nodes, RenderCtx ctx) {
    List<String> parts = new ArrayList<>(nodes.size());
    for (SqlNode x : nodes) parts.add(renderNode(x, ctx));
    return String.join(", ", parts);
  }

  private String valueSql(Object value, RenderCtx ctx) {
    if (value == null) return "NULL";
    if (!ctx.inline) return ctx.add(value);
    return literal(value);
  }

  /** Inline SQL literal; strings are single-quoted with embedded quotes doubled. */
  protected String literal(Object value) {
    if (value == null) return "NULL";
    if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (value instanceof Number num) return num.toString();
    if (value instanceof Enum<?> e) return "'" + e.name().replace("'", "''") + "'";
    return "'" + String.valueOf(value).replace("'", "''") + "'";
  }
}
