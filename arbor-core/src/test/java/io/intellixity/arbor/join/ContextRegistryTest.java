package io.intellixity.arbor.join;

import io.intellixity.arbor.TestModels;
import io.intellixity.arbor.ast.Column;
import io.intellixity.arbor.ast.Comparison;
import io.intellixity.arbor.ast.Conjunction;
import io.intellixity.arbor.ast.TableRef;
import io.intellixity.arbor.ast.Value;
import io.intellixity.arbor.query.Clause;
import io.intellixity.arbor.query.Operator;
import io.intellixity.arbor.query.ResolutionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ContextRegistryTest {
  private static ContextRegistry registry(String type) {
    var authoring = TestModels.registry();
    return new ContextRegistry(authoring, authoring.getEntityAuthoring(type), List.of(), 64);
  }

  @Test
  void registerReturnsExistingNodeForSamePath() {
    ContextRegistry r = registry("Person");
    JoinNode a = r.register(r.root(), JoinKey.of("children"), JoinType.INNER, JoinOrigin.JOIN);
    JoinNode b = r.register(r.root(), JoinKey.of("children"), JoinType.INNER, JoinOrigin.JOIN);
    assertSame(a, b);
    assertEquals(1, r.joinNodes().size());
  }

  @Test
  void firstJoinTypeWins() {
    ContextRegistry r = registry("Person");
    JoinNode a = r.register(r.root(), JoinKey.of("articles").outer(), JoinType.INNER, JoinOrigin.JOIN);
    JoinNode b = r.register(r.root(), JoinKey.of("articles").inner(), JoinType.INNER, JoinOrigin.JOIN);
    assertSame(a, b);
    assertEquals(JoinType.OUTER, b.joinType());
  }

  @Test
  void rootKeepsTableNameAndFirstSelfJoinGetsAssociationAlias() {
    ContextRegistry r = registry("Person");
    assertEquals(new TableRef("people", "people"), r.root().table());
    assertTrue(r.root().isRoot());

    JoinNode children = r.register(r.root(), JoinKey.of("children"), JoinType.INNER, JoinOrigin.JOIN);
    assertEquals("children_people", children.alias());
    assertEquals(
        new Comparison(Operator.EQ, new Column(children.table(), "parent_id"), new Column(r.root().table(), "id")),
        children.on());
  }

  @Test
  void belongsToConditionPointsAtOwnerForeignKey() {
    ContextRegistry r = registry("Article");
    JoinNode person = r.register(r.root(), JoinKey.of("person"), JoinType.INNER, JoinOrigin.JOIN);
    assertEquals("people", person.alias());
    assertEquals(
        new Comparison(Operator.EQ, new Column(person.table(), "id"), new Column(r.root().table(), "person_id")),
        person.on());
  }

  @Test
  void polymorphicTypesAreSeparatePaths() {
    ContextRegistry r = registry("Note");
    JoinNode article = r.register(r.root(), JoinKey.of("notable", "Article"), JoinType.INNER, JoinOrigin.JOIN);
    JoinNode person = r.register(r.root(), JoinKey.of("notable", "Person"), JoinType.INNER, JoinOrigin.JOIN);
    assertNotSame(article, person);
    assertEquals("articles", article.alias());
    assertEquals("people", person.alias());

    TableRef notes = r.root().table();
    assertEquals(new Conjunction(Clause.AND, List.of(
        new Comparison(Operator.EQ, new Column(article.table(), "id"), new Column(notes, "notable_id")),
        new Comparison(Operator.EQ, new Column(notes, "notable_type"), new Value("Article")))), article.on());

    assertSame(article, r.resolvePolymorphic(JoinPath.root(), "notable", "Article"));
    assertSame(person, r.child(r.root(), JoinKey.of("notable", "Person")));
  }

  @Test
  void inversePolymorphicAddsTypeCondition() {
    ContextRegistry r = registry("Person");
    JoinNode notes = r.register(r.root(), JoinKey.of("notes"), JoinType.INNER, JoinOrigin.JOIN);
    TableRef people = r.root().table();
    assertEquals(new Conjunction(Clause.AND, List.of(
        new Comparison(Operator.EQ, new Column(notes.table(), "notable_id"), new Column(people, "id")),
        new Comparison(Operator.EQ, new Column(notes.table(), "notable_type"), new Value("Person")))), notes.on());
  }

  @Test
  void polymorphicWithoutTypeIsAmbiguous() {
    ContextRegistry r = registry("Note");
    ResolutionException ex = assertThrows(ResolutionException.class,
        () -> r.register(r.root(), JoinKey.of("notable"), JoinType.INNER, JoinOrigin.JOIN));
    assertTrue(ex.getMessage().contains("requires a type"));
  }

  @Test
  void unknownAssociationAndTargetFail() {
    ContextRegistry r = registry("Person");
    assertThrows(ResolutionException.class,
        () -> r.register(r.root(), JoinKey.of("siblings"), JoinType.INNER, JoinOrigin.JOIN));

    ContextRegistry notes = registry("Note");
    assertThrows(ResolutionException.class,
        () -> notes.register(notes.root(), JoinKey.of("notable", "Widget"), JoinType.INNER, JoinOrigin.JOIN));
  }

  @Test
  void typeArgumentOnPlainAssociationIsRejected() {
    ContextRegistry r = registry("Person");
    assertThrows(ResolutionException.class,
        () -> r.register(r.root(), JoinKey.of("articles", "Note"), JoinType.INNER, JoinOrigin.JOIN));
    // naming the declared target is harmless and shares the plain path
    JoinNode a = r.register(r.root(), JoinKey.of("articles", "Article"), JoinType.INNER, JoinOrigin.JOIN);
    assertSame(a, r.register(r.root(), JoinKey.of("articles"), JoinType.INNER, JoinOrigin.JOIN));
  }

  @Test
  void lookupOfUnjoinedPathFails() {
    ContextRegistry r = registry("Person");
    assertSame(r.root(), r.lookup(JoinPath.root()));
    assertTrue(r.find(JoinPath.of(new PathSegment("children", null))).isEmpty());
    ResolutionException ex = assertThrows(ResolutionException.class,
        () -> r.child(r.root(), JoinKey.of("children")));
    assertTrue(ex.getMessage().contains("not joined"));
  }
}
