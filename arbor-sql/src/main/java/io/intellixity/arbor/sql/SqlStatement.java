package io.intellixity.arbor.sql;

import java.util.List;
import java.util.Objects;

public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
  }
}
