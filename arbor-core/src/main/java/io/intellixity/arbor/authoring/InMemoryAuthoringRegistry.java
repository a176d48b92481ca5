package io.intellixity.arbor.authoring;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple in-memory {@link AuthoringRegistry}.
 *
 * Useful for tests, demos, and authoring loaded once at startup.
 */
public final class InMemoryAuthoringRegistry implements AuthoringRegistry {
  private final Map<String, EntityAuthoring> entities = new LinkedHashMap<>();

  public InMemoryAuthoringRegistry(List<EntityAuthoring> eas) {
    for (EntityAuthoring ea : eas) {
      if (entities.putIfAbsent(ea.type(), ea) != null) {
        throw new IllegalArgumentException("Duplicate authoring type: " + ea.type());
      }
    }
  }

  @Override
  public EntityAuthoring getEntityAuthoring(String type) {
    EntityAuthoring ea = entities.get(type);
    if (ea == null) throw new IllegalArgumentException("Unknown authoring type: " + type);
    return ea;
  }

  @Override
  public boolean contains(String type) {
    return entities.containsKey(type);
  }

  public Collection<EntityAuthoring> allEntities() {
    return Collections.unmodifiableCollection(entities.values());
  }
}
