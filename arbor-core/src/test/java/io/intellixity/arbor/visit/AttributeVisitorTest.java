package io.intellixity.arbor.visit;

import io.intellixity.arbor.TestModels;
import io.intellixity.arbor.ast.*;
import io.intellixity.arbor.join.ContextRegistry;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.query.Ordering;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.arbor.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class AttributeVisitorTest {
  @Test
  void hashesAndListsFlattenToQualifiedColumns() {
    AttributeVisitor v = TestModels.person().joins("children", "articles").attributeVisitor();
    ContextRegistry r = v.registry();
    TableRef children = r.joinNodes().get(0).table();
    TableRef articles = r.joinNodes().get(1).table();

    List<SqlNode> nodes = v.acceptAll(List.of(
        attr("id"),
        hash("children", List.of("name", "salary"), "articles", "title")), r.root());

    assertEquals(List.of(
        new Column(r.root().table(), "id"),
        new Column(children, "name"),
        new Column(children, "salary"),
        new Column(articles, "title")), nodes);
  }

  @Test
  void functionArgumentsAreQualifiedInTheirContext() {
    AttributeVisitor v = TestModels.person().joins("children").attributeVisitor();
    ContextRegistry r = v.registry();
    TableRef children = r.joinNodes().get(0).table();

    SqlNode n = v.accept(fn("max", path("children").attr("salary")).as("max_salary"), r.root());

    assertEquals(new Aliased(new Function("max", List.of(new Column(children, "salary"))), "max_salary"), n);
  }

  @Test
  void operatorsAndOrderingKeepTheirShape() {
    AttributeVisitor v = TestModels.person().attributeVisitor();
    JoinNode root = v.registry().root();
    TableRef people = root.table();

    assertEquals(new Infix("+", new Column(people, "salary"), new Value(100)),
        v.accept(attr("salary").plus(100), root));
    assertEquals(new Infix("||", new Column(people, "name"), new Value("-x")),
        v.accept(attr("name").op("||", "-x"), root));
    assertEquals(new Ordered(new Column(people, "name"), Ordering.Direction.DESC),
        v.accept(attr("name").desc(), root));
    assertEquals(new Negate(new Column(people, "salary")), v.accept(negate(attr("salary")), root));
  }

  @Test
  void stringsAreRawAtTopLevelAndAttributesInsideHashes() {
    AttributeVisitor v = TestModels.person().joins("children").attributeVisitor();
    ContextRegistry r = v.registry();

    assertEquals(new Raw("count(*) AS total"), v.accept("count(*) AS total", r.root()));
    assertThrows(IllegalArgumentException.class, () -> v.accept(hash("name", "x"), r.root()));
    assertThrows(IllegalArgumentException.class, () -> v.accept(42, r.root()));
  }
}
