package com.verso.registry.repository;

import com.verso.registry.domain.Entity;
import com.verso.registry.listing.PageRequest;
import com.verso.registry.listing.TextValue;
import java.util.List;
import java.util.Optional;

/**
 * Versioned key-value store for one entity kind. Writes replace the current version and its index
 * rows atomically; reads never fail for a missing record, they return empty.
 * Implementations raise {@link StoreException} for any other failure.
 */
public interface EntityStore<T extends Entity> {

    EntityTable<T> getTable();

    void write(T entity);

    Optional<T> read(String id);

    boolean exists(String id);

    /**
     * Removes the entity, its versions and index rows, returning the last version.
     */
    Optional<T> delete(String id);

    /**
     * Removes one version and returns it. If it was current, the latest remaining version is
     * promoted; if none remains the entity is removed.
     */
    Optional<T> deleteVersion(String id, String versionId);

    List<T> readVersions(String id, PageRequest page);

    Optional<T> readVersion(String id, String versionId);

    List<String> pageIds(PageRequest page);

    List<String> allIds();

    /**
     * Distinct keys of an index, in ascending order.
     */
    List<String> indexKeys(String index);

    List<TextValue> pageTextValues(String index, String key, PageRequest page);

    List<TextValue> allTextValues(String index, String key);

    List<T> pageEntities(String index, String key, PageRequest page);

    List<T> allEntities(String index, String key);
}
