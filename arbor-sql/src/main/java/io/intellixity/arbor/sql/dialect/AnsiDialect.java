package io.intellixity.arbor.sql.dialect;

import io.intellixity.arbor.relation.OffsetPage;

/** Standard SQL: double-quoted identifiers, {@code OFFSET .. FETCH NEXT} paging. */
public class AnsiDialect extends AbstractSqlDialect {
  @Override public String id() { return "ansi"; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " OFFSET " + page.offset() + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY";
  }
}
