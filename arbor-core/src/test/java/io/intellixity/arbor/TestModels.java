package io.intellixity.arbor;

import io.intellixity.arbor.authoring.AssociationDef;
import io.intellixity.arbor.authoring.EntityAuthoring;
import io.intellixity.arbor.authoring.InMemoryAuthoringRegistry;
import io.intellixity.arbor.relation.Relation;

import java.util.List;

/** People with self-referential parent/children, articles, comments and polymorphic notes. */
public final class TestModels {
  private TestModels() {}

  public static final EntityAuthoring PERSON = EntityAuthoring.builder("Person", "people")
      .columns("id", "parent_id", "name", "salary")
      .association(AssociationDef.belongsTo("parent", "Person", "parent_id"))
      .association(AssociationDef.hasMany("children", "Person", "parent_id"))
      .association(AssociationDef.hasMany("articles", "Article", "person_id"))
      .association(AssociationDef.hasMany("comments", "Comment", "person_id"))
      .association(AssociationDef.hasManyAs("notes", "Note", "notable"))
      .build();

  public static final EntityAuthoring ARTICLE = EntityAuthoring.builder("Article", "articles")
      .columns("id", "person_id", "title", "body")
      .association(AssociationDef.belongsTo("person", "Person"))
      .association(AssociationDef.hasMany("comments", "Comment", "article_id"))
      .association(AssociationDef.hasManyAs("notes", "Note", "notable"))
      .build();

  public static final EntityAuthoring COMMENT = EntityAuthoring.builder("Comment", "comments")
      .columns("id", "article_id", "person_id", "body")
      .association(AssociationDef.belongsTo("article", "Article"))
      .association(AssociationDef.belongsTo("person", "Person"))
      .build();

  public static final EntityAuthoring NOTE = EntityAuthoring.builder("Note", "notes")
      .columns("id", "notable_type", "notable_id", "note")
      .association(AssociationDef.polymorphicBelongsTo("notable"))
      .build();

  public static InMemoryAuthoringRegistry registry() {
    return new InMemoryAuthoringRegistry(List.of(PERSON, ARTICLE, COMMENT, NOTE));
  }

  public static Relation person() {
    return Relation.from(registry(), "Person");
  }

  public static Relation article() {
    return Relation.from(registry(), "Article");
  }

  public static Relation note() {
    return Relation.from(registry(), "Note");
  }
}
