package io.intellixity.arbor.sql.postgres;

import io.intellixity.arbor.query.Operator;
import io.intellixity.arbor.relation.OffsetPage;
import io.intellixity.arbor.sql.dialect.AbstractSqlDialect;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides; generic rendering lives in {@link AbstractSqlDialect}.
 * Pattern matches are case-insensitive ({@code ILIKE}).
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " LIMIT " + page.limit() + " OFFSET " + page.offset();
  }

  @Override
  protected String operatorSql(Operator op) {
    if (op == Operator.MATCHES) return "ILIKE";
    if (op == Operator.DOES_NOT_MATCH) return "NOT ILIKE";
    return super.operatorSql(op);
  }
}
