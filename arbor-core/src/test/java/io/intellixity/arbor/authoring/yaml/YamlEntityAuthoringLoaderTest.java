package io.intellixity.arbor.authoring.yaml;

import io.intellixity.arbor.authoring.AssociationDef;
import io.intellixity.arbor.authoring.AssociationKind;
import io.intellixity.arbor.authoring.EntityAuthoring;
import io.intellixity.arbor.authoring.InMemoryAuthoringRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class YamlEntityAuthoringLoaderTest {
  private final YamlEntityAuthoringLoader loader = new YamlEntityAuthoringLoader();

  @Test
  void loadsEntitiesWithConventionalDefaults() {
    List<EntityAuthoring> entities = loader.loadResource("authoring/people.yml");
    assertEquals(2, entities.size());

    EntityAuthoring person = entities.get(0);
    assertEquals("Person", person.type());
    assertEquals("people", person.table());
    assertEquals("id", person.primaryKey());
    assertEquals(List.of("id", "parent_id", "name", "salary"), person.columns());
    assertEquals(List.of("parent", "children", "articles", "comments", "notes"),
        List.copyOf(person.associations().keySet()));

    AssociationDef parent = person.associations().get("parent");
    assertEquals(AssociationKind.BELONGS_TO, parent.kind());
    assertEquals("parent_id", parent.foreignKey());
    assertEquals("person_id", person.associations().get("articles").foreignKey());
    assertEquals("parent_id", person.associations().get("children").foreignKey());

    AssociationDef notes = person.associations().get("notes");
    assertTrue(notes.isPolymorphicInverse());
    assertEquals("notable_id", notes.foreignKey());
    assertEquals("notable_type", notes.foreignType());
  }

  @Test
  void loadsDirectoryInFileNameOrder() throws Exception {
    Path dir = Path.of(getClass().getResource("/authoring").toURI());
    List<EntityAuthoring> entities = loader.loadDir(dir);
    assertEquals(List.of("Person", "Article", "Comment", "Note"),
        entities.stream().map(EntityAuthoring::type).toList());

    AssociationDef notable = entities.get(3).associations().get("notable");
    assertTrue(notable.polymorphic());
    assertNull(notable.target());
    assertEquals("notable_id", notable.foreignKey());
    assertEquals("notable_type", notable.foreignType());

    InMemoryAuthoringRegistry registry = new InMemoryAuthoringRegistry(entities);
    assertTrue(registry.contains("Comment"));
  }

  @Test
  void singleDocumentAndExplicitTable() {
    String yaml = "type: BlogPost\nprimaryKey: post_id\ncolumns: [post_id]\n";
    List<EntityAuthoring> entities = loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    assertEquals(1, entities.size());
    assertEquals("blog_posts", entities.get(0).table());
    assertEquals("post_id", entities.get(0).primaryKey());
  }

  @Test
  void rejectsMalformedAuthoring() {
    assertThrows(IllegalArgumentException.class, () -> loader.loadResource("authoring/missing.yml"));
    assertThrows(IllegalArgumentException.class, () -> load("type: A\nassociations:\n  b: { target: B }\n"));
    assertThrows(IllegalArgumentException.class, () -> load("type: A\ncolumns: id\n"));
    assertThrows(IllegalArgumentException.class, () -> load("- 1\n- 2\n"));
  }

  private List<EntityAuthoring> load(String yaml) {
    return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }
}
