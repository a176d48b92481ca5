package io.intellixity.arbor.sql.dialect;

import io.intellixity.arbor.util.ArborFactoriesLoader;

import java.util.List;
import java.util.Objects;

/** Lookup of the {@link SqlDialect}s registered in {@code META-INF/arbor.factories}. */
public final class SqlDialects {
  private SqlDialects() {}

  public static List<SqlDialect> all() {
    return ArborFactoriesLoader.load(SqlDialect.class);
  }

  public static SqlDialect byId(String id) {
    Objects.requireNonNull(id, "id");
    for (SqlDialect d : all()) {
      if (d.id().equals(id)) return d;
    }
    throw new IllegalArgumentException("Unknown SQL dialect: " + id);
  }
}
