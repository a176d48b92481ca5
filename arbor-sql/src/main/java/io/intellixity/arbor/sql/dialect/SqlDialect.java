package io.intellixity.arbor.sql.dialect;

import io.intellixity.arbor.relation.ComposedQuery;
import io.intellixity.arbor.sql.SqlStatement;

/**
 * Lowers a {@link ComposedQuery} to SQL text.
 * <p>
 * Implementations are discovered through {@code META-INF/arbor.factories}; see {@link SqlDialects}.
 */
public interface SqlDialect {
  /** Stable identifier, e.g. {@code "ansi"} or {@code "postgres"}. */
  String id();

  /** SELECT statement with values as {@code :bN} binds. */
  SqlStatement render(ComposedQuery query);

  /** SELECT statement with values inlined as SQL literals. */
  String toSql(ComposedQuery query);

  /** Row count of {@code query}. */
  SqlStatement renderCount(ComposedQuery query);
}
