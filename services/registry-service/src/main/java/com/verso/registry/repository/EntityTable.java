package com.verso.registry.repository;

import com.verso.registry.domain.Entity;
import com.verso.registry.domain.VersionedEntity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Storage layout of one entity kind: its type name, class and secondary indexes.
 */
public final class EntityTable<T extends Entity> {
    private final String entityType;
    private final Class<T> type;
    private final Map<String, IndexDefinition<T>> indexes;

    @SafeVarargs
    public EntityTable(String entityType, Class<T> type, IndexDefinition<T>... indexes) {
        this.entityType = entityType;
        this.type = type;
        Map<String, IndexDefinition<T>> byName = new LinkedHashMap<>();
        for (IndexDefinition<T> index : indexes) {
            byName.put(index.name(), index);
        }
        this.indexes = Map.copyOf(byName);
    }

    public String getEntityType() {
        return entityType;
    }

    public Class<T> getType() {
        return type;
    }

    public boolean isVersioned() {
        return VersionedEntity.class.isAssignableFrom(type);
    }

    public Collection<IndexDefinition<T>> getIndexes() {
        return indexes.values();
    }

    /**
     * Index keys the stores cannot hold, as validation problems.
     */
    public List<String> keyProblems(T entity) {
        List<String> problems = new ArrayList<>();
        for (IndexDefinition<T> index : indexes.values()) {
            for (String key : index.keys().apply(entity)) {
                if (key.length() > IndexDefinition.MAX_KEY_LENGTH) {
                    problems.add(index.name() + " value is longer than " + IndexDefinition.MAX_KEY_LENGTH + " characters");
                    break;
                }
            }
        }
        return problems;
    }

    public IndexDefinition<T> index(String name) {
        IndexDefinition<T> index = indexes.get(name);
        if (index == null) {
            throw new IllegalArgumentException("unknown index " + name + " for " + entityType);
        }
        return index;
    }
}
