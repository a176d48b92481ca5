package io.intellixity.arbor.authoring.yaml;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.arbor.authoring.AssociationDef;
import io.intellixity.arbor.authoring.AssociationKind;
import io.intellixity.arbor.authoring.EntityAuthoring;
import io.intellixity.arbor.util.Inflector;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads {@link EntityAuthoring} from YAML.
 *
 * <pre>
 * type: Person
 * table: people
 * columns: [id, parent_id, name, salary]
 * associations:
 *   parent:   { kind: belongs_to, target: Person }
 *   children: { kind: has_many, target: Person, foreignKey: parent_id }
 *   notes:    { kind: has_many, target: Note, as: notable }
 * </pre>
 *
 * A document is either one entity or a list of entities. Foreign keys default by naming convention:
 * {@code x_id} for belongs_to {@code x}, {@code <owner>_id} for has_many/has_one, {@code <as>_id} and
 * {@code <as>_type} for polymorphic associations.
 */
public final class YamlEntityAuthoringLoader {
  private static final TypeReference<Object> DOC = new TypeReference<>() {};

  private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

  public List<EntityAuthoring> load(InputStream in) {
    Objects.requireNonNull(in, "in");
    Object doc;
    try {
      doc = mapper.readValue(in, DOC);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse authoring YAML", e);
    }
    return toEntities(doc);
  }

  public List<EntityAuthoring> loadFile(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read authoring file: " + file, e);
    }
  }

  /** Every {@code .yml}/{@code .yaml} file directly under {@code dir}, in file name order. */
  public List<EntityAuthoring> loadDir(Path dir) {
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(p -> {
            String n = p.getFileName().toString();
            return n.endsWith(".yml") || n.endsWith(".yaml");
          })
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list authoring dir: " + dir, e);
    }
    List<EntityAuthoring> out = new ArrayList<>();
    for (Path f : files) out.addAll(loadFile(f));
    return out;
  }

  public List<EntityAuthoring> loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = YamlEntityAuthoringLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Authoring resource not found: " + resource);
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read authoring resource: " + resource, e);
    }
  }

  private static List<EntityAuthoring> toEntities(Object doc) {
    if (doc instanceof List<?> l) {
      List<EntityAuthoring> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toEntity(asMap(o, "entity")));
      return out;
    }
    return List.of(toEntity(asMap(doc, "entity")));
  }

  private static EntityAuthoring toEntity(Map<?, ?> m) {
    String type = str(m.get("type"));
    String table = str(m.get("table"));
    if (table == null && type != null) table = Inflector.pluralize(Inflector.underscore(type));

    List<String> columns = new ArrayList<>();
    Object cols = m.get("columns");
    if (cols instanceof List<?> l) {
      for (Object c : l) columns.add(String.valueOf(c));
    } else if (cols != null) {
      throw new IllegalArgumentException("columns must be a list in authoring: " + type);
    }

    Map<String, AssociationDef> associations = new LinkedHashMap<>();
    Object assocs = m.get("associations");
    if (assocs != null) {
      for (var e : asMap(assocs, "associations of " + type).entrySet()) {
        String name = String.valueOf(e.getKey());
        associations.put(name, toAssociation(type, name, asMap(e.getValue(), "association " + name)));
      }
    }
    return new EntityAuthoring(type, table, str(m.get("primaryKey")), columns, associations);
  }

  private static AssociationDef toAssociation(String owner, String name, Map<?, ?> m) {
    String kindStr = str(m.get("kind"));
    if (kindStr == null) throw new IllegalArgumentException("kind is required for association '" + name + "' of " + owner);
    AssociationKind kind = AssociationKind.valueOf(kindStr.trim().toUpperCase(Locale.ROOT));
    boolean polymorphic = Boolean.TRUE.equals(m.get("polymorphic"));
    String as = str(m.get("as"));

    String foreignKey = str(m.get("foreignKey"));
    String foreignType = str(m.get("foreignType"));
    if (foreignKey == null) {
      if (as != null) foreignKey = as + "_id";
      else if (kind == AssociationKind.BELONGS_TO) foreignKey = name + "_id";
      else foreignKey = Inflector.foreignKey(owner);
    }
    if (foreignType == null) {
      if (polymorphic) foreignType = name + "_type";
      else if (as != null) foreignType = as + "_type";
    }

    return new AssociationDef(name, kind, str(m.get("target")), foreignKey, str(m.get("primaryKey")),
        polymorphic, as, foreignType);
  }

  private static Map<?, ?> asMap(Object o, String what) {
    if (o instanceof Map<?, ?> m) return m;
    throw new IllegalArgumentException("Expected a mapping for " + what + ", got: " + o);
  }

  private static String str(Object o) {
    return o == null ? null : String.valueOf(o);
  }
}
