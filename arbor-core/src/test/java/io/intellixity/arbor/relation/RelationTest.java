package io.intellixity.arbor.relation;

import io.intellixity.arbor.TestModels;
import io.intellixity.arbor.ast.*;
import io.intellixity.arbor.join.JoinNode;
import io.intellixity.arbor.join.JoinOrigin;
import io.intellixity.arbor.join.JoinType;
import io.intellixity.arbor.query.Clause;
import io.intellixity.arbor.query.HashSpec;
import io.intellixity.arbor.query.Operator;
import io.intellixity.arbor.query.ResolutionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.arbor.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class RelationTest {
  @Test
  void whereValuesAreKeptAsAuthored() {
    Map<String, Object> literal = new LinkedHashMap<>();
    literal.put("name", "bob");

    Relation r = TestModels.person()
        .where(literal)
        .where("salary > ?", 10)
        .where(List.of("name = ?", "O'Neil"))
        .where("parent_id = :pid", Map.of("pid", 3))
        .where(attr("name").matches("B%"));

    assertEquals(List.of(
        literal,
        "salary > 10",
        "name = 'O''Neil'",
        "parent_id = 3",
        attr("name").matches("B%")), r.whereValues());
    assertFalse(r.whereValues().get(0) instanceof HashSpec);

    literal.put("salary", 1);
    assertEquals(Map.of("name", "bob"), r.whereValues().get(0));
  }

  @Test
  void authoredMapConditionsAreLoweredAtBuild() {
    Map<String, Object> literal = new LinkedHashMap<>();
    literal.put("parent_id", null);
    ComposedQuery q = TestModels.person().where(literal).build();
    assertEquals(new Comparison(Operator.EQ, new Column(q.root(), "parent_id"), new Value(null)), q.wherePredicate());
    assertThrows(IllegalArgumentException.class, () -> TestModels.person().where(new LinkedHashMap<>()));
  }

  @Test
  void relationsAreImmutable() {
    Relation base = TestModels.person().where(hash("name", "a"));
    Relation refined = base.where(hash("salary", 1)).joins("children");

    assertEquals(1, base.whereValues().size());
    assertTrue(base.joinValues().isEmpty());
    assertEquals(2, refined.whereValues().size());
  }

  @Test
  void repeatedWheresAreAndCombinedAndLastEqualityWins() {
    Relation r = TestModels.person()
        .joins("children")
        .where(hash("name", "Ernie"))
        .where(attr("name").eq("Bert").and(attr("salary").eq(100)))
        .where(hash("children", hash("name", "Elmo")));

    ComposedQuery q = r.build();
    TableRef people = q.root();
    SqlNode where = q.wherePredicate();
    Conjunction and = assertInstanceOf(Conjunction.class, where);
    assertEquals(Clause.AND, and.clause());
    assertEquals(3, and.nodes().size());
    assertEquals(new Comparison(Operator.EQ, new Column(people, "name"), new Value("Ernie")), and.nodes().get(0));

    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("name", "Bert");
    expected.put("salary", 100);
    assertEquals(expected, r.whereValuesHash());
  }

  @Test
  void whereValuesHashKeepsNullEqualities() {
    Map<String, Object> values = TestModels.person().where(hash("parent_id", null)).whereValuesHash();
    assertTrue(values.containsKey("parent_id"));
    assertNull(values.get("parent_id"));
  }

  @Test
  void mergeWithSameBaseConcatenatesClauses() {
    Relation a = TestModels.person().where(hash("name", "a")).order(attr("name"));
    Relation b = TestModels.person().joins("children").where(hash("salary", 1)).order(attr("id")).page(20, 10);

    Relation merged = a.merge(b);
    assertEquals(List.of(hash("name", "a"), hash("salary", 1)), merged.whereValues());
    assertEquals(List.of(attr("name"), attr("id")), merged.orderValues());
    assertEquals(List.of("children"), merged.joinValues());
    assertEquals(new OffsetPage(20, 10), merged.page());

    Relation reordered = a.merge(TestModels.person().reorder(attr("salary").desc()));
    assertEquals(List.of(attr("salary").desc()), reordered.orderValues());
  }

  @Test
  void mergeWithOtherBaseJoinsThroughAssociation() {
    Relation people = TestModels.person().joins("children").where(hash("name", "Bob"));
    Relation merged = TestModels.article().where(hash("title", "Hello")).merge(people);

    ComposedQuery q = merged.build();
    assertEquals(2, q.joins().size());
    JoinNode person = q.joins().get(0);
    JoinNode children = q.joins().get(1);
    assertEquals("person", person.path().toString());
    assertEquals(JoinType.INNER, person.joinType());
    assertEquals("people", person.alias());
    assertEquals("person.children", children.path().toString());
    assertEquals("children_people", children.alias());

    assertEquals(2, q.wheres().size());
    assertEquals(new Comparison(Operator.EQ, new Column(q.root(), "title"), new Value("Hello")), q.wheres().get(0).node());
    ContextualizedFragment merged1 = q.wheres().get(1);
    assertSame(person, merged1.context());
    assertEquals(new Comparison(Operator.EQ, new Column(person.table(), "name"), new Value("Bob")), merged1.node());

    assertEquals(Map.of("title", "Hello"), merged.whereValuesHash());
  }

  @Test
  void mergeWithoutRelationPathFails() {
    ResolutionException ex = assertThrows(ResolutionException.class,
        () -> TestModels.note().merge(TestModels.person()));
    assertTrue(ex.getMessage().contains("no association"));
  }

  @Test
  void includesArePreloadedUnlessReferenced() {
    ComposedQuery plain = TestModels.person().includes("articles").build();
    assertTrue(plain.joins().isEmpty());
    assertEquals(List.of("articles"), plain.preloads());
    assertFalse(plain.eagerLoading());

    ComposedQuery referenced = TestModels.person().includes("articles")
        .where(path("articles").attr("title").eq("x")).build();
    assertEquals(1, referenced.joins().size());
    assertEquals(JoinType.OUTER, referenced.joins().get(0).joinType());
    assertEquals(JoinOrigin.INCLUDE, referenced.joins().get(0).origin());
    assertTrue(referenced.eagerLoading());
    assertTrue(referenced.preloads().isEmpty());

    ComposedQuery raw = TestModels.person().includes("articles").where("articles.title = 'x'").build();
    assertTrue(raw.eagerLoading());

    ComposedQuery eager = TestModels.person().eagerLoad("articles").preload("comments").build();
    assertEquals(1, eager.joins().size());
    assertEquals(List.of("comments"), eager.preloads());
    assertTrue(eager.eagerLoading());
  }

  @Test
  void includesReferencedBySelectOrGroupAreJoined() {
    ComposedQuery selected = TestModels.person().includes("articles")
        .select(path("articles").attr("title")).build();
    assertEquals(1, selected.joins().size());
    assertEquals("articles", selected.joins().get(0).alias());
    assertTrue(selected.eagerLoading());
    assertTrue(selected.preloads().isEmpty());

    ComposedQuery grouped = TestModels.person().includes("articles")
        .select(fn("count", attr("id")))
        .group(path("articles").attr("title")).build();
    assertEquals(1, grouped.joins().size());
    assertTrue(grouped.eagerLoading());
    assertTrue(grouped.preloads().isEmpty());

    ComposedQuery rawSelect = TestModels.person().includes("articles").select("articles.title").build();
    assertTrue(rawSelect.eagerLoading());

    for (ComposedQuery q : List.of(selected, grouped)) {
      List<ContextualizedFragment> projections = new ArrayList<>(q.selects());
      projections.addAll(q.groups());
      for (ContextualizedFragment f : projections) {
        for (TableRef t : SqlNodes.referencedTables(f.node())) {
          assertTrue(t.equals(q.root()) || q.joins().stream().anyMatch(j -> j.table().equals(t)),
              "unjoined table " + t);
        }
      }
    }
  }

  @Test
  void joinsKeepPrecedenceOverIncludes() {
    ComposedQuery q = TestModels.person().includes("articles").joins("articles").build();
    assertEquals(1, q.joins().size());
    assertEquals(JoinType.INNER, q.joins().get(0).joinType());
    assertEquals(JoinOrigin.JOIN, q.joins().get(0).origin());
  }

  @Test
  void projectionsGroupAndHavingAreContextualized() {
    ComposedQuery q = TestModels.person()
        .select(attr("parent_id"), fn("max", attr("salary")).as("top"))
        .group(attr("parent_id"))
        .having(fn("max", attr("salary")).gt(100))
        .order("top DESC")
        .build();
    TableRef people = q.root();

    assertEquals(2, q.selects().size());
    assertEquals(new Aliased(new Function("max", List.of(new Column(people, "salary"))), "top"), q.selects().get(1).node());
    assertEquals(List.of(new ContextualizedFragment(q.selects().get(0).context(), new Column(people, "parent_id"))),
        q.groups());
    assertEquals(new Comparison(Operator.GT, new Function("max", List.of(new Column(people, "salary"))), new Value(100)),
        q.havingPredicate());
    assertEquals(new Raw("top DESC"), q.orders().get(0).node());
  }

  @Test
  void invalidInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> TestModels.person().page(-1, 10));
    assertThrows(IllegalArgumentException.class, () -> TestModels.person().page(0, 0));
    assertThrows(IllegalArgumentException.class, () -> TestModels.person().where(List.of(1, 2)));
    assertThrows(IllegalArgumentException.class, () -> TestModels.person().where("a = ? AND b = ?", 1));
    assertThrows(IllegalArgumentException.class, () -> Relation.from(TestModels.registry(), "Widget"));
    assertThrows(ResolutionException.class, () -> TestModels.person().joins("friends").build());
  }
}
