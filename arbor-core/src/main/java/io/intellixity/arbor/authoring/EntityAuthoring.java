package io.intellixity.arbor.authoring;

import java.util.*;

public record EntityAuthoring(
    String type,
    /** Table backing the entity. */
    String table,
    String primaryKey,
    List<String> columns,
    /** Declaration order is kept; merges pick the first association matching a target type. */
    Map<String, AssociationDef> associations
) {
  public EntityAuthoring {
    if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required for authoring");
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required for authoring: " + type);
    primaryKey = (primaryKey == null || primaryKey.isBlank()) ? "id" : primaryKey;
    columns = columns == null ? List.of() : List.copyOf(columns);
    associations = associations == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(associations));
    for (var e : associations.entrySet()) {
      if (!e.getKey().equals(e.getValue().name())) {
        throw new IllegalArgumentException("association key '" + e.getKey() + "' does not match its name '" +
            e.getValue().name() + "' in authoring: " + type);
      }
    }
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  public Optional<AssociationDef> association(String name) {
    return Optional.ofNullable(associations.get(name));
  }

  public static Builder builder(String type, String table) {
    return new Builder(type, table);
  }

  public static final class Builder {
    private final String type;
    private final String table;
    private String primaryKey = "id";
    private final List<String> columns = new ArrayList<>();
    private final Map<String, AssociationDef> associations = new LinkedHashMap<>();

    private Builder(String type, String table) {
      this.type = type;
      this.table = table;
    }

    public Builder primaryKey(String primaryKey) { this.primaryKey = primaryKey; return this; }
    public Builder columns(String... columns) { this.columns.addAll(List.of(columns)); return this; }
    public Builder association(AssociationDef a) { this.associations.put(a.name(), a); return this; }

    public EntityAuthoring build() {
      return new EntityAuthoring(type, table, primaryKey, columns, associations);
    }
  }
}
