package io.intellixity.arbor.relation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SqlSanitizerTest {
  @Test
  void replacesPositionalPlaceholders() {
    assertEquals("name = 'O''Brien' AND id IN (1,2)",
        SqlSanitizer.sanitize("name = ? AND id IN (?)", "O'Brien", List.of(1, 2)));
    assertEquals("name = '?' AND id = 3", SqlSanitizer.sanitize("name = '?' AND id = ?", 3));
  }

  @Test
  void replacesNamedPlaceholdersAndLeavesCasts() {
    assertEquals("name = 'a' AND x::text = 1",
        SqlSanitizer.sanitize("name = :name AND x::text = :x", Map.of("name", "a", "x", 1)));
  }

  @Test
  void rejectsMismatchedBinds() {
    assertThrows(IllegalArgumentException.class, () -> SqlSanitizer.sanitize("a = ?"));
    assertThrows(IllegalArgumentException.class, () -> SqlSanitizer.sanitize("a = ?", 1, 2));
    assertThrows(IllegalArgumentException.class, () -> SqlSanitizer.sanitize("a = :a", Map.of("b", 1)));
  }

  @Test
  void quotesValues() {
    assertEquals("NULL", SqlSanitizer.quote(null));
    assertEquals("TRUE", SqlSanitizer.quote(true));
    assertEquals("NULL", SqlSanitizer.quote(List.of()));
    assertEquals("'a','b'", SqlSanitizer.quote(new String[]{"a", "b"}));
  }
}
