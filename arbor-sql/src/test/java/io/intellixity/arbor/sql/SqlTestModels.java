package io.intellixity.arbor.sql;

import io.intellixity.arbor.authoring.AuthoringRegistry;
import io.intellixity.arbor.authoring.EntityAuthoring;
import io.intellixity.arbor.authoring.InMemoryAuthoringRegistry;
import io.intellixity.arbor.authoring.yaml.YamlEntityAuthoringLoader;
import io.intellixity.arbor.relation.Relation;

import java.util.ArrayList;
import java.util.List;

/** Person/Article/Comment/Note authoring loaded from the test YAML resources. */
public final class SqlTestModels {
  private static final AuthoringRegistry REGISTRY = load();

  private SqlTestModels() {}

  private static AuthoringRegistry load() {
    YamlEntityAuthoringLoader loader = new YamlEntityAuthoringLoader();
    List<EntityAuthoring> all = new ArrayList<>();
    all.addAll(loader.loadResource("authoring/people.yml"));
    all.addAll(loader.loadResource("authoring/social.yaml"));
    return new InMemoryAuthoringRegistry(all);
  }

  public static Relation person() { return Relation.from(REGISTRY, "Person"); }
  public static Relation article() { return Relation.from(REGISTRY, "Article"); }
  public static Relation note() { return Relation.from(REGISTRY, "Note"); }
}
