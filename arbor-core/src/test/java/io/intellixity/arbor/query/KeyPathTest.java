package io.intellixity.arbor.query;

import io.intellixity.arbor.join.JoinKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.arbor.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class KeyPathTest {
  @Test
  void joinTypeIsPrintedApartFromPathSteps() {
    KeyPath typed = assoc("articles").outer().then("comments");
    KeyPath threeSteps = KeyPath.parse("articles.outer.comments");

    assertEquals("articles[outer].comments", typed.toString());
    assertEquals("articles.outer.comments", threeSteps.toString());
    assertNotEquals(typed.toString(), threeSteps.toString());
    assertEquals("notable(Article)[inner]", assoc("notable", "Article").inner().toString());
    assertEquals("children.name -> Attribute[name=salary]", path("children.name").attr("salary").toString());
  }

  @Test
  void parsesDottedPaths() {
    assertEquals(List.of(JoinKey.of("children"), JoinKey.of("parent")), KeyPath.parse("children.parent").keys());
    assertThrows(IllegalArgumentException.class, () -> KeyPath.parse("children..parent"));
    assertThrows(IllegalArgumentException.class, () -> KeyPath.parse("children."));
    assertThrows(IllegalStateException.class, () -> path("children").attr("name").then("parent"));
  }
}
