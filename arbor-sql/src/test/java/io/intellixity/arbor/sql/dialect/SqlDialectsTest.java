package io.intellixity.arbor.sql.dialect;

import io.intellixity.arbor.sql.postgres.PostgresDialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlDialectsTest {
  @Test
  void discoversRegisteredDialects() {
    List<String> ids = SqlDialects.all().stream().map(SqlDialect::id).toList();
    assertEquals(List.of("ansi", "postgres"), ids);
    assertInstanceOf(PostgresDialect.class, SqlDialects.byId("postgres"));
    assertInstanceOf(AnsiDialect.class, SqlDialects.byId("ansi"));
  }

  @Test
  void unknownDialectIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> SqlDialects.byId("oracle"));
    assertEquals("Unknown SQL dialect: oracle", ex.getMessage());
  }
}
